package com.smartfix.request.repository;

import com.smartfix.request.Fixtures;
import com.smartfix.request.entity.Proposal;
import com.smartfix.request.entity.ServiceRequest;
import com.smartfix.shared.enums.ProposalStatus;
import com.smartfix.shared.enums.RequestStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static com.smartfix.request.Fixtures.NOW;
import static com.smartfix.request.Fixtures.ORIGIN_LAT;
import static com.smartfix.request.Fixtures.ORIGIN_LNG;
import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class ServiceRequestRepositoryTest {

    @Autowired
    private ServiceRequestRepository requestRepository;

    @Test
    void acceptIfPendingSucceedsOnlyOnce() {
        ServiceRequest request = newRequest();
        request.addProposal(newProposal("prv_1", "150"));
        request.addProposal(newProposal("prv_2", "170"));
        requestRepository.saveAndFlush(request);

        int first = requestRepository.acceptIfPending(request.getId(), "prv_1", new BigDecimal("150"), NOW);
        int second = requestRepository.acceptIfPending(request.getId(), "prv_2", new BigDecimal("170"), NOW);

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();

        ServiceRequest reloaded = requestRepository.findById(request.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(RequestStatus.ACCEPTED);
        assertThat(reloaded.getProviderId()).isEqualTo("prv_1");
        assertThat(reloaded.getPayment().getAmount()).isEqualByComparingTo("150");
        assertThat(reloaded.getUpdatedAt()).isEqualTo(NOW);
        assertThat(reloaded.getVersion()).isEqualTo(1L);
    }

    @Test
    void acceptIfPendingIgnoresCancelledRequest() {
        ServiceRequest request = newRequest();
        request.setStatus(RequestStatus.CANCELLED);
        requestRepository.saveAndFlush(request);

        assertThat(requestRepository.acceptIfPending(request.getId(), "prv_1", BigDecimal.TEN, NOW)).isZero();
        assertThat(requestRepository.findById(request.getId()).orElseThrow().getProviderId()).isNull();
    }

    @Test
    void openRequestsExcludeOwnBidsOtherStatusesTypesAndArea() {
        ServiceRequest open = newRequest();
        open.setCreatedAt(NOW.minus(Duration.ofHours(3)));

        ServiceRequest alreadyBid = newRequest();
        alreadyBid.setCreatedAt(NOW.minus(Duration.ofHours(1)));
        Proposal withdrawn = newProposal("prv_1", "120");
        withdrawn.setStatus(ProposalStatus.WITHDRAWN);
        alreadyBid.addProposal(withdrawn);

        ServiceRequest accepted = newRequest();
        accepted.setStatus(RequestStatus.ACCEPTED);

        ServiceRequest otherType = newRequest();
        otherType.setServiceType("electrical");

        ServiceRequest farAway = newRequest();
        farAway.getLocation().setLatitude(ORIGIN_LAT + 2.0);

        requestRepository.saveAllAndFlush(List.of(open, alreadyBid, accepted, otherType, farAway));

        List<ServiceRequest> forProvider1 = requestRepository.findOpenRequestsForProvider(
                List.of(Fixtures.SERVICE_TYPE),
                ORIGIN_LAT - 0.5, ORIGIN_LAT + 0.5, ORIGIN_LNG - 0.5, ORIGIN_LNG + 0.5,
                "prv_1");
        List<ServiceRequest> forProvider2 = requestRepository.findOpenRequestsForProvider(
                List.of(Fixtures.SERVICE_TYPE),
                ORIGIN_LAT - 0.5, ORIGIN_LAT + 0.5, ORIGIN_LNG - 0.5, ORIGIN_LNG + 0.5,
                "prv_2");

        assertThat(forProvider1).extracting(ServiceRequest::getId).containsExactly(open.getId());
        // newest first
        assertThat(forProvider2).extracting(ServiceRequest::getId).containsExactly(alreadyBid.getId(), open.getId());
    }

    private static ServiceRequest newRequest() {
        ServiceRequest request = Fixtures.pendingRequest(UUID.randomUUID());
        request.setVersion(null);
        return request;
    }

    private static Proposal newProposal(String providerId, String price) {
        Proposal proposal = Fixtures.proposal(UUID.randomUUID(), providerId, price);
        proposal.setVersion(null);
        return proposal;
    }
}
