package com.ai.booking.repository;

import com.ai.booking.entity.BookingRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BookingRecordRepository extends JpaRepository<BookingRecord, Long> {

    Optional<BookingRecord> findByIdempotencyToken(String idempotencyToken);
}
