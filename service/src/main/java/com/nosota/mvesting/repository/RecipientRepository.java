package com.nosota.mvesting.repository;

import com.nosota.mvesting.model.Recipient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface RecipientRepository extends JpaRepository<Recipient, String> {

    /**
     * Finds which of the given addresses are already registered.
     * Used to reject batches that would overwrite an existing schedule.
     *
     * @param addresses Normalized addresses
     * @return Existing recipients among them
     */
    List<Recipient> findByAddressIn(Collection<String> addresses);
}
