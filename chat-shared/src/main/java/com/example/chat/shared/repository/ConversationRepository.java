package com.example.chat.shared.repository;

import com.example.chat.shared.model.Conversation;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ConversationRepository extends CrudRepository<Conversation, Long> {

    Optional<Conversation> findByPairKey(String pairKey);

    @Query("""
        SELECT c.* FROM conversations c
        JOIN conversation_participants p ON p.conversation_id = c.id
        WHERE p.user_id = :userId
          AND p.left_at IS NULL
          AND c.active = TRUE
        ORDER BY c.updated_at DESC, c.id DESC
        LIMIT :limit OFFSET :offset
    """)
    List<Conversation> findActiveByParticipant(@Param("userId") String userId,
                                               @Param("limit") int limit,
                                               @Param("offset") long offset);

    @Query("""
        SELECT COUNT(*) FROM conversations c
        JOIN conversation_participants p ON p.conversation_id = c.id
        WHERE p.user_id = :userId
          AND p.left_at IS NULL
          AND c.active = TRUE
    """)
    long countActiveByParticipant(@Param("userId") String userId);

    @Query("""
        SELECT c.id FROM conversations c
        JOIN conversation_participants p ON p.conversation_id = c.id
        WHERE p.user_id = :userId
          AND p.left_at IS NULL
          AND c.active = TRUE
    """)
    List<Long> findActiveConversationIds(@Param("userId") String userId);

    @Query("""
        SELECT c.* FROM conversations c
        JOIN conversation_participants p ON p.conversation_id = c.id
        WHERE p.typing = TRUE
          AND p.last_typing_at < :cutoff
    """)
    List<Conversation> findWithTypingStartedBefore(@Param("cutoff") OffsetDateTime cutoff);
}
