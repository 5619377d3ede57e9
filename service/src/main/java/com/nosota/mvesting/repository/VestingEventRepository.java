package com.nosota.mvesting.repository;

import com.nosota.mvesting.model.VestingEvent;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface VestingEventRepository extends JpaRepository<VestingEvent, Long> {

    Page<VestingEvent> findAllByOrderByIdDesc(Pageable pageable);

    Page<VestingEvent> findByRecipientAddressOrderByIdDesc(String recipientAddress, Pageable pageable);
}
