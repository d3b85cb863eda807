package com.wadechandler.identity.repository;

import com.wadechandler.identity.model.Contact;
import com.wadechandler.identity.model.LinkPrecedence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface ContactRepository extends JpaRepository<Contact, Long> {

    @Query("""
            select c from Contact c
            where c.deletedAt is null and (c.email = :email or c.phoneNumber = :phoneNumber)
            order by c.createdAt asc, c.id asc
            """)
    List<Contact> findActiveByEmailOrPhoneNumber(@Param("email") String email,
                                                 @Param("phoneNumber") String phoneNumber);

    @Query("""
            select c from Contact c
            where c.deletedAt is null and c.email = :email
            order by c.createdAt asc, c.id asc
            """)
    List<Contact> findActiveByEmail(@Param("email") String email);

    @Query("""
            select c from Contact c
            where c.deletedAt is null and c.phoneNumber = :phoneNumber
            order by c.createdAt asc, c.id asc
            """)
    List<Contact> findActiveByPhoneNumber(@Param("phoneNumber") String phoneNumber);

    List<Contact> findByIdInOrderByCreatedAtAscIdAsc(Collection<Long> ids);

    @Query("""
            select c from Contact c
            where c.deletedAt is null and (c.id = :primaryId or c.linkedId = :primaryId)
            order by c.createdAt asc, c.id asc
            """)
    List<Contact> findActiveCluster(@Param("primaryId") Long primaryId);

    /**
     * Row-locks the given contacts until the surrounding transaction ends. Rows are locked
     * in id order so concurrent merges over overlapping rows queue instead of deadlocking.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from Contact c where c.id in :ids order by c.id asc")
    List<Contact> lockByIds(@Param("ids") Collection<Long> ids);

    /** Demotes live primaries only; a row that is already secondary is left untouched. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Contact c
            set c.linkPrecedence = :precedence, c.linkedId = :primaryId, c.updatedAt = :now
            where c.id in :ids and c.deletedAt is null
              and c.linkPrecedence = com.wadechandler.identity.model.LinkPrecedence.PRIMARY
            """)
    int demote(@Param("ids") Collection<Long> ids,
               @Param("primaryId") Long primaryId,
               @Param("precedence") LinkPrecedence precedence,
               @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Contact c
            set c.linkedId = :primaryId, c.updatedAt = :now
            where c.linkedId in :oldLinkedIds and c.deletedAt is null
            """)
    int relink(@Param("oldLinkedIds") Collection<Long> oldLinkedIds,
               @Param("primaryId") Long primaryId,
               @Param("now") Instant now);
}
