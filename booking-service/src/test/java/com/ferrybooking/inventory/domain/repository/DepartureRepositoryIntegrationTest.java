package com.ferrybooking.inventory.domain.repository;

import com.ferrybooking.inventory.domain.model.Departure;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Conditional seat updates against a real PostgreSQL, schema from the Flyway migrations.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
class DepartureRepositoryIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("ferry_booking")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 9, 0);

    @Autowired
    private DepartureRepository repository;

    private Departure departure(int seats, LocalDateTime departureTime) {
        return repository.saveAndFlush(Departure.builder()
                .routeCode("MRK-BKH")
                .originPort("Merak")
                .destinationPort("Bakauheni")
                .vesselName("KMP Legundi")
                .departureTime(departureTime)
                .totalSeats(seats)
                .availableSeats(seats)
                .fare(new BigDecimal("150000.00"))
                .build());
    }

    @Test
    @DisplayName("reserveSeatsAtomically never oversells: at most the initial stock is handed out")
    void reserveSeatsAtomically_neverOversells() {
        Departure departure = departure(5, NOW.plusDays(1));

        int successfulUpdates = 0;
        for (int i = 0; i < 10; i++) {
            successfulUpdates += repository.reserveSeatsAtomically(departure.getId(), 1, NOW);
        }

        assertThat(successfulUpdates).isEqualTo(5);
        assertThat(repository.findById(departure.getId()).orElseThrow().getAvailableSeats()).isZero();
    }

    @Test
    void multiSeatRequest_isAllOrNothing() {
        Departure departure = departure(5, NOW.plusDays(1));

        assertThat(repository.reserveSeatsAtomically(departure.getId(), 3, NOW)).isEqualTo(1);
        assertThat(repository.reserveSeatsAtomically(departure.getId(), 3, NOW)).isZero();
        assertThat(repository.findById(departure.getId()).orElseThrow().getAvailableSeats()).isEqualTo(2);
    }

    @Test
    void departedVoyage_isNotBookable() {
        Departure departure = departure(5, NOW.minusMinutes(1));

        assertThat(repository.reserveSeatsAtomically(departure.getId(), 1, NOW)).isZero();
    }

    @Test
    void releaseSeatsAtomically_neverExceedsCapacity() {
        Departure departure = departure(5, NOW.plusDays(1));
        repository.reserveSeatsAtomically(departure.getId(), 2, NOW);

        assertThat(repository.releaseSeatsAtomically(departure.getId(), 2, NOW)).isEqualTo(1);
        assertThat(repository.releaseSeatsAtomically(departure.getId(), 1, NOW)).isZero();
        assertThat(repository.findById(departure.getId()).orElseThrow().getAvailableSeats()).isEqualTo(5);
    }
}
