package com.queueserve.repository.jpa;

import com.queueserve.entity.MenuItemEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MenuItemJpaRepository extends JpaRepository<MenuItemEntity, String> {

    List<MenuItemEntity> findByAvailableTrueOrderByCategoryAscNameAsc();

    List<MenuItemEntity> findAllByOrderByCategoryAscNameAsc();
}
