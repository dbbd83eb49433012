package com.ferrybooking.inventory.api.controller;

import com.ferrybooking.common.dto.BaseResponse;
import com.ferrybooking.common.exception.ResourceNotFoundException;
import com.ferrybooking.inventory.api.dto.DepartureResponse;
import com.ferrybooking.inventory.domain.repository.DepartureRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of departure capacity.
 */
@RestController
@RequestMapping("/api/v1/departures")
@RequiredArgsConstructor
public class DepartureController {

    private final DepartureRepository departureRepository;

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<DepartureResponse>> getDeparture(@PathVariable Long id) {
        DepartureResponse response = departureRepository.findById(id)
                .map(DepartureResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException("Departure", id));
        return ResponseEntity.ok(BaseResponse.success(response));
    }
}
