package com.tradefeed.orderservice.service;

import com.tradefeed.common.dto.StockShortfall;
import com.tradefeed.common.exception.InsufficientStockException;
import com.tradefeed.orderservice.config.OrderProperties;
import com.tradefeed.orderservice.config.StockPolicy;
import com.tradefeed.orderservice.event.OrderEventPublisher;
import com.tradefeed.orderservice.model.Order;
import com.tradefeed.orderservice.model.OrderItem;
import com.tradefeed.orderservice.model.OrderStatus;
import com.tradefeed.orderservice.repository.OrderRepository;
import com.tradefeed.orderservice.repository.ProductVariantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Creates an order and takes its stock in one transaction: the order number,
 * the order row, every line item, every stock decrement and the order.created
 * outbox event commit together or not at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderTransactionService {

    private final OrderRepository orderRepository;
    private final ProductVariantRepository productVariantRepository;
    private final OrderNumberGenerator orderNumberGenerator;
    private final OrderEventPublisher orderEventPublisher;
    private final OrderProperties orderProperties;

    /**
     * @throws InsufficientStockException if any decrement could not be applied;
     *         the whole transaction is rolled back and every shortfall is listed
     * @throws com.tradefeed.orderservice.exception.OrderNumberExhaustedException
     *         if no free order number was found
     */
    @Transactional
    public Order createOrder(CreateOrderCommand command) {
        log.info("Order transaction started. tenantId={}, lines={}", command.getTenantId(), command.getLines().size());

        String orderNumber = orderNumberGenerator.allocate();

        Order order = new Order();
        order.setOrderNumber(orderNumber);
        order.setTenantId(command.getTenantId());
        order.setBuyerName(command.getBuyerName());
        order.setBuyerPhone(command.getBuyerPhone());
        order.setBuyerNote(command.getBuyerNote());
        order.setDeliveryAddress(command.getDeliveryAddress());
        order.setChatMessage(command.getChatMessage());
        order.setStatus(OrderStatus.PENDING);

        // totals are derived from the lines here, never taken from the client
        for (CartLine line : command.getLines()) {
            order.addItem(toOrderItem(line));
        }

        // flush so the number's unique constraint and the timestamps are settled before the event is built
        Order savedOrder = orderRepository.saveAndFlush(order);
        log.info("Order saved. orderNumber={}, totalCents={}, itemCount={}",
                savedOrder.getOrderNumber(), savedOrder.getTotalCents(), savedOrder.getItemCount());

        takeStock(command.getLines());

        orderEventPublisher.orderPlaced(savedOrder);

        return savedOrder;
    }

    /**
     * Decrements every variant in ascending id order, so two checkouts sharing
     * variants lock their rows in the same order.
     */
    private void takeStock(List<CartLine> lines) {
        Map<UUID, Integer> quantities = new TreeMap<>();
        Map<UUID, String> names = new HashMap<>();
        for (CartLine line : lines) {
            quantities.merge(line.getVariantId(), line.getQuantity(), Integer::sum);
            names.putIfAbsent(line.getVariantId(), line.getProductName());
        }

        StockPolicy policy = orderProperties.getStockPolicy();
        List<StockShortfall> shortfalls = new ArrayList<>();

        for (Map.Entry<UUID, Integer> entry : quantities.entrySet()) {
            UUID variantId = entry.getKey();
            int quantity = entry.getValue();

            int updated = policy == StockPolicy.CONDITIONAL
                    ? productVariantRepository.decrementStockIfAvailable(variantId, quantity)
                    : productVariantRepository.decrementStock(variantId, quantity);

            if (updated == 0) {
                int available = policy == StockPolicy.CONDITIONAL
                        ? productVariantRepository.findStockById(variantId).orElse(0)
                        : 0;
                shortfalls.add(StockShortfall.builder()
                        .variantId(variantId)
                        .productName(names.get(variantId))
                        .requested(quantity)
                        .available(Math.max(available, 0))
                        .build());
                continue;
            }

            if (policy == StockPolicy.UNCONDITIONAL) {
                productVariantRepository.findStockById(variantId)
                        .filter(stock -> stock < 0)
                        .ifPresent(stock -> log.warn("Variant oversold: variantId={}, stock={}", variantId, stock));
            }
        }

        if (!shortfalls.isEmpty()) {
            log.info("Stock decrement failed, rolling back order. shortfalls={}", shortfalls);
            throw new InsufficientStockException(shortfalls);
        }
    }

    private static OrderItem toOrderItem(CartLine line) {
        OrderItem item = new OrderItem();
        item.setProductId(line.getProductId());
        item.setVariantId(line.getVariantId());
        item.setProductName(line.getProductName());
        item.setOption1Label(line.getOption1Label());
        item.setOption1Value(line.getOption1Value());
        item.setOption2Label(line.getOption2Label());
        item.setOption2Value(line.getOption2Value());
        item.setUnitPriceCents(line.getUnitPriceCents());
        item.setQuantity(line.getQuantity());
        return item;
    }
}
