package com.tradefeed.orderservice.mapper;

import com.tradefeed.common.contracts.OrderLineContract;
import com.tradefeed.common.contracts.OrderPlacedContract;
import com.tradefeed.orderservice.dto.OrderItemResponse;
import com.tradefeed.orderservice.dto.OrderResponse;
import com.tradefeed.orderservice.dto.TrackedOrderResponse;
import com.tradefeed.orderservice.model.Order;
import com.tradefeed.orderservice.model.OrderItem;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    @Mapping(target = "allowedTransitions",
            expression = "java(order.getStatus() == null ? java.util.Set.of() : order.getStatus().allowedTargets())")
    OrderResponse toOrderResponse(Order order);

    OrderItemResponse toOrderItemResponse(OrderItem orderItem);

    // phone is masked by the query layer, never copied raw
    @Mapping(target = "buyerPhone", ignore = true)
    TrackedOrderResponse toTrackedOrderResponse(Order order);

    @Mapping(source = "id", target = "orderId")
    @Mapping(source = "deliveryAddress.address", target = "deliveryAddress")
    @Mapping(source = "deliveryAddress.city", target = "deliveryCity")
    @Mapping(source = "deliveryAddress.province", target = "deliveryProvince")
    @Mapping(source = "deliveryAddress.postalCode", target = "deliveryPostalCode")
    OrderPlacedContract toOrderPlacedContract(Order order);

    OrderLineContract toOrderLineContract(OrderItem orderItem);
}
