package com.foo.sheetsync.persistence.repository;

import com.foo.sheetsync.persistence.entity.Shipment;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ShipmentRepository extends JpaRepository<Shipment, Long> {

  Optional<Shipment> findByShipmentNo(String shipmentNo);

  /** 주문명으로 활성 레코드를 찾는다. 대소문자와 앞뒤 공백을 무시한다. */
  @Query(
      "select s from Shipment s"
          + " where lower(trim(s.orderName)) = lower(:orderName) and s.deleted = false"
          + " order by s.id")
  List<Shipment> findActiveByOrderName(@Param("orderName") String orderName);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "update Shipment s set s.deleted = true, s.updatedAt = :now"
          + " where s.shipmentNo in :shipmentNos and s.deleted = false")
  int softDeleteAll(
      @Param("shipmentNos") Collection<String> shipmentNos, @Param("now") LocalDateTime now);
}
