package com.nosota.mvesting.repository;

import com.nosota.mvesting.model.Escrow;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EscrowRepository extends JpaRepository<Escrow, Integer> {
    /**
     * Retrieves the escrow row and locks it for update.
     * <p>
     * Every mutating vesting operation starts here, so holding this lock for the length of
     * the transaction serializes all operations: none of them can observe a partially
     * applied effect of another.
     * </p>
     *
     * @param id The escrow id (always {@link Escrow#SINGLETON_ID}).
     * @return The escrow, locked for update, if it was already created.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM Escrow e WHERE e.id = :id")
    Optional<Escrow> findByIdForUpdate(@Param("id") Integer id);

    /**
     * Creates the initial escrow row unless it already exists.
     * <p>
     * A concurrent insert of the same id waits for the other transaction and then does
     * nothing, so the first operations of two transactions never collide on the primary key.
     * </p>
     *
     * @return 1 if the row was created, 0 if it already existed.
     */
    @Modifying
    @Query(value = """
            INSERT INTO escrow (id, status, safe_address, escrow_address,
                                total_allocated_supply, total_claimed, total_seized, dust, updated_at)
            VALUES (:id, 'ACTIVE', :safeAddress, :escrowAddress, 0, 0, 0, 0, CURRENT_TIMESTAMP)
            ON CONFLICT (id) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") Integer id,
                       @Param("escrowAddress") String escrowAddress,
                       @Param("safeAddress") String safeAddress);
}
