package com.queueserve.mapper;

import com.queueserve.domain.model.MenuItem;
import com.queueserve.entity.MenuItemEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface MenuItemMapper {

    MenuItemEntity toEntity(MenuItem menuItem);

    MenuItem toDomain(MenuItemEntity entity);

    List<MenuItem> toDomainList(List<MenuItemEntity> entities);
}
