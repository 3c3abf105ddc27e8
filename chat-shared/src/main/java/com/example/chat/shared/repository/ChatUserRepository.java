package com.example.chat.shared.repository;

import com.example.chat.shared.model.ChatUser;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;

@Repository
public interface ChatUserRepository extends CrudRepository<ChatUser, String> {

    @Modifying
    @Query("UPDATE chat_users SET online_status = :status, last_active_at = :lastActiveAt WHERE id = :userId")
    int updatePresence(@Param("userId") String userId,
                       @Param("status") String status,
                       @Param("lastActiveAt") OffsetDateTime lastActiveAt);
}
