package com.example.chat.shared.repository;

import com.example.chat.shared.model.UserConnection;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserConnectionRepository extends CrudRepository<UserConnection, Long> {

    @Query("SELECT connection_user_id FROM user_connections WHERE user_id = :userId AND status = 'ACCEPTED'")
    List<String> findAcceptedConnectionIds(@Param("userId") String userId);

    @Query("""
        SELECT COUNT(*) FROM user_connections
        WHERE status = 'BLOCKED'
          AND ((user_id = :userA AND connection_user_id = :userB)
            OR (user_id = :userB AND connection_user_id = :userA))
    """)
    long countBlocksBetween(@Param("userA") String userA, @Param("userB") String userB);
}
