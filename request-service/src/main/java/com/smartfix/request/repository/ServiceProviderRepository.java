package com.smartfix.request.repository;

import com.smartfix.request.entity.ServiceProvider;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ServiceProviderRepository extends JpaRepository<ServiceProvider, String> {

    Optional<ServiceProvider> findByUserId(String userId);

    @Query("SELECT DISTINCT p FROM ServiceProvider p JOIN p.services s "
            + "WHERE p.id IN :ids AND s IN :services AND p.verified = true AND p.available = true")
    List<ServiceProvider> findEligible(Collection<String> ids, Collection<String> services);

    @Query("SELECT p FROM ServiceProvider p WHERE p.verified = true AND p.available = true")
    List<ServiceProvider> findAllActive();

    @Modifying
    @Query("UPDATE ServiceProvider p SET p.completedJobs = p.completedJobs + 1 WHERE p.id = :id")
    int incrementCompletedJobs(String id);
}
