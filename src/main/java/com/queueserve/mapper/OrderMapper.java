package com.queueserve.mapper;

import com.queueserve.domain.model.LineItem;
import com.queueserve.domain.model.Order;
import com.queueserve.entity.LineItemEmbeddable;
import com.queueserve.entity.OrderEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between the Order domain model and OrderEntity.
 * Line items map one-to-one onto the embeddable rows.
 */
@Mapper
public interface OrderMapper {

    OrderEntity toEntity(Order order);

    Order toDomain(OrderEntity entity);

    List<Order> toDomainList(List<OrderEntity> entities);

    LineItemEmbeddable toEmbeddable(LineItem lineItem);

    LineItem toLineItem(LineItemEmbeddable embeddable);
}
