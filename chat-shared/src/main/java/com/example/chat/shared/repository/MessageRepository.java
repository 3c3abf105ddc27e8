package com.example.chat.shared.repository;

import com.example.chat.shared.model.Message;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface MessageRepository extends CrudRepository<Message, Long> {

    /** Newest page first; callers reverse it for display. */
    @Query("""
        SELECT * FROM chat_messages
        WHERE conversation_id = :conversationId
          AND removed = FALSE
        ORDER BY seq DESC
        LIMIT :limit OFFSET :offset
    """)
    List<Message> findPageNewestFirst(@Param("conversationId") Long conversationId,
                                      @Param("limit") int limit,
                                      @Param("offset") long offset);

    @Query("""
        SELECT COUNT(*) FROM chat_messages
        WHERE conversation_id = :conversationId
          AND removed = FALSE
    """)
    long countVisible(@Param("conversationId") Long conversationId);

    @Query("""
        SELECT * FROM chat_messages
        WHERE conversation_id = :conversationId
          AND id IN (:ids)
    """)
    List<Message> findByConversationIdAndIdIn(@Param("conversationId") Long conversationId,
                                              @Param("ids") Collection<Long> ids);

    @Query("""
        SELECT m.* FROM chat_messages m
        WHERE m.conversation_id IN (:conversationIds)
          AND m.removed = FALSE
          AND m.type <> 'SYSTEM'
          AND LOWER(m.original_text) LIKE :pattern
        ORDER BY m.created_at DESC, m.id DESC
        LIMIT :limit OFFSET :offset
    """)
    List<Message> searchInConversations(@Param("conversationIds") Collection<Long> conversationIds,
                                        @Param("pattern") String pattern,
                                        @Param("limit") int limit,
                                        @Param("offset") long offset);

    @Query("""
        SELECT COUNT(*) FROM chat_messages m
        WHERE m.conversation_id IN (:conversationIds)
          AND m.removed = FALSE
          AND m.type <> 'SYSTEM'
          AND LOWER(m.original_text) LIKE :pattern
    """)
    long countSearchHits(@Param("conversationIds") Collection<Long> conversationIds,
                         @Param("pattern") String pattern);

    @Query("""
        SELECT id FROM chat_messages
        WHERE expires_at IS NOT NULL
          AND expires_at <= :now
          AND removed = FALSE
    """)
    List<Long> findExpiredIds(@Param("now") OffsetDateTime now);
}
