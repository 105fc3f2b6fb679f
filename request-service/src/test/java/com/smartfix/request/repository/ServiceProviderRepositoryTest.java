package com.smartfix.request.repository;

import com.smartfix.request.Fixtures;
import com.smartfix.request.entity.ServiceProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.smartfix.request.Fixtures.ORIGIN_LAT;
import static com.smartfix.request.Fixtures.ORIGIN_LNG;
import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class ServiceProviderRepositoryTest {

    @Autowired
    private ServiceProviderRepository providerRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void findEligibleKeepsVerifiedAvailableProvidersOfTheService() {
        ServiceProvider plumber = provider("prv_plumber", Set.of("plumbing"));
        ServiceProvider handyman = provider("prv_handyman", Set.of("plumbing", "carpentry"));
        ServiceProvider electrician = provider("prv_electrician", Set.of("electrical"));
        ServiceProvider unverified = provider("prv_unverified", Set.of("plumbing"));
        unverified.setVerified(false);
        ServiceProvider away = provider("prv_away", Set.of("plumbing"));
        away.setAvailable(false);
        providerRepository.saveAllAndFlush(List.of(plumber, handyman, electrician, unverified, away));

        List<ServiceProvider> eligible = providerRepository.findEligible(
                List.of("prv_plumber", "prv_handyman", "prv_electrician", "prv_unverified", "prv_away"),
                List.of("plumbing", "carpentry"));

        assertThat(eligible).extracting(ServiceProvider::getId)
                .containsExactlyInAnyOrder("prv_plumber", "prv_handyman");
    }

    @Test
    void findByUserIdLoadsPricingAndAvailability() {
        ServiceProvider plumber = provider("prv_plumber", Set.of("plumbing"));
        plumber.getFixedPrices().put("plumbing", new BigDecimal("120.00"));
        providerRepository.saveAndFlush(plumber);
        entityManager.clear();

        ServiceProvider loaded = providerRepository.findByUserId("usr_prv_plumber").orElseThrow();

        assertThat(loaded.fixedPriceFor("Plumbing")).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("120"));
        assertThat(loaded.getAvailability()).hasSize(7);
        assertThat(loaded.getServiceArea().getRadiusKm()).isEqualTo(20.0);
    }

    @Test
    void incrementCompletedJobs() {
        providerRepository.saveAndFlush(provider("prv_plumber", Set.of("plumbing")));

        int updated = providerRepository.incrementCompletedJobs("prv_plumber");
        entityManager.clear();

        assertThat(updated).isEqualTo(1);
        assertThat(providerRepository.findById("prv_plumber").orElseThrow().getCompletedJobs()).isEqualTo(21);
        assertThat(providerRepository.incrementCompletedJobs("prv_missing")).isZero();
    }

    private static ServiceProvider provider(String id, Set<String> services) {
        ServiceProvider provider = Fixtures.provider(id, ORIGIN_LNG, ORIGIN_LAT, 20, "50");
        provider.setServices(new HashSet<>(services));
        return provider;
    }
}
