package com.ferrybooking.booking.domain.repository;

import com.ferrybooking.booking.domain.model.Passenger;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PassengerRepository extends JpaRepository<Passenger, Long> {

    List<Passenger> findByBookingIdOrderByIdAsc(Long bookingId);
}
