package com.queueserve.mapper;

import com.queueserve.domain.model.Cart;
import com.queueserve.domain.model.CartLine;
import com.queueserve.entity.CartEntity;
import com.queueserve.entity.CartLineEmbeddable;
import org.mapstruct.Mapper;

@Mapper
public interface CartMapper {

    CartEntity toEntity(Cart cart);

    Cart toDomain(CartEntity entity);

    CartLineEmbeddable toEmbeddable(CartLine cartLine);

    CartLine toCartLine(CartLineEmbeddable embeddable);
}
