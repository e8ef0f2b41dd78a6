package com.farewatch.ml.repo;

import com.farewatch.ml.entity.Route;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface RouteRepository extends JpaRepository<Route, String> {

  @Query(value = "SELECT CAST(r.id AS text) FROM routes r WHERE r.tier = :tier " +
      "ORDER BY r.priority_score DESC LIMIT :limit", nativeQuery = true)
  List<String> findTopPriorityRouteIds(@Param("tier") String tier, @Param("limit") int limit);

  @Query(value = "SELECT CAST(r.id AS text) FROM routes r WHERE r.tier IN (:tiers) ORDER BY r.priority_score DESC",
      nativeQuery = true)
  List<String> findRouteIdsByTiers(@Param("tiers") Collection<String> tiers);
}
