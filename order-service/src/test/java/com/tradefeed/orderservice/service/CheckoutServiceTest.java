package com.tradefeed.orderservice.service;

import com.tradefeed.common.dto.StockShortfall;
import com.tradefeed.common.exception.InsufficientStockException;
import com.tradefeed.orderservice.collaborator.CatalogSnapshot;
import com.tradefeed.orderservice.collaborator.CatalogSnapshotReader;
import com.tradefeed.orderservice.dto.CheckoutItemRequest;
import com.tradefeed.orderservice.dto.CheckoutRequest;
import com.tradefeed.orderservice.dto.OrderResponse;
import com.tradefeed.orderservice.dto.StockValidationResult;
import com.tradefeed.orderservice.exception.InvalidCartException;
import com.tradefeed.orderservice.mapper.OrderMapper;
import com.tradefeed.orderservice.model.DeliveryAddress;
import com.tradefeed.orderservice.model.Order;
import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CheckoutServiceTest {

    @Mock
    private CatalogSnapshotReader catalogSnapshotReader;
    @Mock
    private StockValidator stockValidator;
    @Mock
    private OrderTransactionService orderTransactionService;
    @Mock
    private OrderMapper orderMapper;

    @InjectMocks
    private CheckoutService checkoutService;

    private UUID tenantId;
    private UUID variantId;

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID();
        variantId = UUID.randomUUID();
    }

    @Test
    void checkout_EmptyCart_RejectedBeforeAnyRead() {
        CheckoutRequest request = new CheckoutRequest();
        request.setItems(new ArrayList<>());

        assertThatThrownBy(() -> checkoutService.checkout(tenantId, request))
                .isInstanceOf(InvalidCartException.class);

        verifyNoInteractions(catalogSnapshotReader, stockValidator, orderTransactionService);
    }

    @Test
    void checkout_ZeroQuantityOrDuplicateLine_Rejected() {
        CheckoutRequest zero = request(new CheckoutItemRequest(variantId, "Suit", 0));
        CheckoutRequest duplicate = request(
                new CheckoutItemRequest(variantId, "Suit", 1),
                new CheckoutItemRequest(variantId, "Suit", 2));

        assertThatThrownBy(() -> checkoutService.checkout(tenantId, zero)).isInstanceOf(InvalidCartException.class);
        assertThatThrownBy(() -> checkoutService.checkout(tenantId, duplicate))
                .isInstanceOf(InvalidCartException.class)
                .hasMessageContaining("more than once");
        verifyNoInteractions(orderTransactionService);
    }

    @Test
    void checkout_VariantOfAnotherShop_Rejected() {
        when(catalogSnapshotReader.readActiveVariants(anyCollection()))
                .thenReturn(Map.of(variantId, snapshot(UUID.randomUUID(), 10)));

        assertThatThrownBy(() -> checkoutService.checkout(tenantId,
                request(new CheckoutItemRequest(variantId, "Suit", 1))))
                .isInstanceOf(InvalidCartException.class);

        verifyNoInteractions(stockValidator, orderTransactionService);
    }

    @Test
    void checkout_InsufficientStock_ThrowsWithAllShortfalls() {
        Map<UUID, CatalogSnapshot> catalog = Map.of(variantId, snapshot(tenantId, 1));
        List<StockShortfall> shortfalls = List.of(StockShortfall.builder()
                .variantId(variantId).productName("Suit").requested(3).available(1).build());
        when(catalogSnapshotReader.readActiveVariants(anyCollection())).thenReturn(catalog);
        when(stockValidator.validate(eq(tenantId), anyList(), eq(catalog)))
                .thenReturn(StockValidationResult.builder().valid(false).shortfalls(shortfalls).build());

        assertThatThrownBy(() -> checkoutService.checkout(tenantId,
                request(new CheckoutItemRequest(variantId, "Suit", 3))))
                .isInstanceOfSatisfying(InsufficientStockException.class,
                        ex -> assertThat(ex.getShortfalls()).isEqualTo(shortfalls));

        verifyNoInteractions(orderTransactionService);
    }

    @Test
    void checkout_ValidCart_PricedFromCatalog() {
        Map<UUID, CatalogSnapshot> catalog = Map.of(variantId, snapshot(tenantId, 10));
        Order order = new Order();
        order.setOrderNumber("TF-20260224-ABCD");
        OrderResponse response = OrderResponse.builder().orderNumber("TF-20260224-ABCD").build();
        when(catalogSnapshotReader.readActiveVariants(anyCollection())).thenReturn(catalog);
        when(stockValidator.validate(eq(tenantId), anyList(), anyMap()))
                .thenReturn(StockValidationResult.builder().valid(true).shortfalls(List.of()).build());
        when(orderTransactionService.createOrder(any(CreateOrderCommand.class))).thenReturn(order);
        when(orderMapper.toOrderResponse(order)).thenReturn(response);

        CheckoutRequest request = request(new CheckoutItemRequest(variantId, "Cheap Suit", 2));
        request.setBuyerName("  Thandi  ");
        request.setBuyerNote("   ");
        DeliveryAddress address = new DeliveryAddress();
        address.setAddress("12 Long Street");
        address.setCity("Cape Town");
        request.setDeliveryAddress(address);

        OrderResponse result = checkoutService.checkout(tenantId, request);

        assertThat(result).isSameAs(response);
        ArgumentCaptor<CreateOrderCommand> captor = ArgumentCaptor.forClass(CreateOrderCommand.class);
        verify(orderTransactionService).createOrder(captor.capture());
        CreateOrderCommand command = captor.getValue();
        assertThat(command.getTenantId()).isEqualTo(tenantId);
        assertThat(command.getBuyerName()).isEqualTo("Thandi");
        assertThat(command.getBuyerNote()).isNull();
        assertThat(command.getDeliveryAddress().getCity()).isEqualTo("Cape Town");
        CartLine line = command.getLines().get(0);
        // name and price come from the catalog, not the buyer's cart
        assertThat(line.getProductName()).isEqualTo("Mint Green Suit Jacket");
        assertThat(line.getUnitPriceCents()).isEqualTo(450000);
        assertThat(line.getQuantity()).isEqualTo(2);
    }

    @Test
    void checkout_BlankDeliveryAddress_Dropped() {
        Map<UUID, CatalogSnapshot> catalog = Map.of(variantId, snapshot(tenantId, 10));
        when(catalogSnapshotReader.readActiveVariants(anyCollection())).thenReturn(catalog);
        when(stockValidator.validate(eq(tenantId), anyList(), anyMap()))
                .thenReturn(StockValidationResult.builder().valid(true).shortfalls(List.of()).build());
        when(orderTransactionService.createOrder(any(CreateOrderCommand.class))).thenReturn(new Order());

        CheckoutRequest request = request(new CheckoutItemRequest(variantId, "Suit", 1));
        DeliveryAddress address = new DeliveryAddress();
        address.setAddress(" ");
        request.setDeliveryAddress(address);

        checkoutService.checkout(tenantId, request);

        ArgumentCaptor<CreateOrderCommand> captor = ArgumentCaptor.forClass(CreateOrderCommand.class);
        verify(orderTransactionService).createOrder(captor.capture());
        assertThat(captor.getValue().getDeliveryAddress()).isNull();
    }

    @Test
    void checkout_OrderNumberTakenConcurrently_RetriesOnce() {
        Map<UUID, CatalogSnapshot> catalog = Map.of(variantId, snapshot(tenantId, 10));
        Order order = new Order();
        order.setOrderNumber("TF-20260224-WXYZ");
        when(catalogSnapshotReader.readActiveVariants(anyCollection())).thenReturn(catalog);
        when(stockValidator.validate(eq(tenantId), anyList(), anyMap()))
                .thenReturn(StockValidationResult.builder().valid(true).shortfalls(List.of()).build());
        when(orderTransactionService.createOrder(any(CreateOrderCommand.class)))
                .thenThrow(integrityViolation(Order.ORDER_NUMBER_CONSTRAINT))
                .thenReturn(order);
        when(orderMapper.toOrderResponse(order))
                .thenReturn(OrderResponse.builder().orderNumber("TF-20260224-WXYZ").build());

        OrderResponse result = checkoutService.checkout(tenantId, request(new CheckoutItemRequest(variantId, "Suit", 1)));

        assertThat(result.getOrderNumber()).isEqualTo("TF-20260224-WXYZ");
        verify(orderTransactionService, times(2)).createOrder(any(CreateOrderCommand.class));
    }

    @Test
    void checkout_OrderNumberTakenTwice_Propagates() {
        Map<UUID, CatalogSnapshot> catalog = Map.of(variantId, snapshot(tenantId, 10));
        when(catalogSnapshotReader.readActiveVariants(anyCollection())).thenReturn(catalog);
        when(stockValidator.validate(eq(tenantId), anyList(), anyMap()))
                .thenReturn(StockValidationResult.builder().valid(true).shortfalls(List.of()).build());
        when(orderTransactionService.createOrder(any(CreateOrderCommand.class)))
                .thenThrow(integrityViolation(Order.ORDER_NUMBER_CONSTRAINT));

        assertThatThrownBy(() -> checkoutService.checkout(tenantId,
                request(new CheckoutItemRequest(variantId, "Suit", 1))))
                .isInstanceOf(DataIntegrityViolationException.class);

        verify(orderTransactionService, times(2)).createOrder(any(CreateOrderCommand.class));
        verifyNoInteractions(orderMapper);
    }

    @Test
    void checkout_OtherIntegrityViolation_NotRetried() {
        Map<UUID, CatalogSnapshot> catalog = Map.of(variantId, snapshot(tenantId, 10));
        when(catalogSnapshotReader.readActiveVariants(anyCollection())).thenReturn(catalog);
        when(stockValidator.validate(eq(tenantId), anyList(), anyMap()))
                .thenReturn(StockValidationResult.builder().valid(true).shortfalls(List.of()).build());
        when(orderTransactionService.createOrder(any(CreateOrderCommand.class)))
                .thenThrow(integrityViolation("fk_order_items_order"));

        assertThatThrownBy(() -> checkoutService.checkout(tenantId,
                request(new CheckoutItemRequest(variantId, "Suit", 1))))
                .isInstanceOf(DataIntegrityViolationException.class);

        verify(orderTransactionService, times(1)).createOrder(any(CreateOrderCommand.class));
    }

    private static DataIntegrityViolationException integrityViolation(String constraint) {
        return new DataIntegrityViolationException("could not execute statement",
                new ConstraintViolationException("duplicate key value violates unique constraint",
                        new SQLException("duplicate key", "23505"), constraint));
    }

    private static CheckoutRequest request(CheckoutItemRequest... items) {
        CheckoutRequest request = new CheckoutRequest();
        request.setItems(List.of(items));
        return request;
    }

    private CatalogSnapshot snapshot(UUID owner, int stock) {
        return CatalogSnapshot.builder()
                .variantId(variantId)
                .productId(UUID.randomUUID())
                .tenantId(owner)
                .productName("Mint Green Suit Jacket")
                .option1Label("Size")
                .option1Value("44")
                .option2Label("Color")
                .option2Value("Teal")
                .priceCents(450000)
                .stock(stock)
                .build();
    }
}
