package com.tradefeed.orderservice.collaborator;

import com.tradefeed.common.contracts.OrderLineContract;
import com.tradefeed.common.contracts.OrderPlacedContract;
import com.tradefeed.orderservice.config.OrderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PlainTextOrderChatComposerTest {

    private PlainTextOrderChatComposer composer;

    @BeforeEach
    void setUp() {
        composer = new PlainTextOrderChatComposer(new OrderProperties());
    }

    @Test
    void compose_MultipleLines_FormatsTotalsAndTrackingLink() {
        OrderPlacedContract order = OrderPlacedContract.builder()
                .orderNumber("TF-20260302-A1B2")
                .totalCents(450000)
                .itemCount(6)
                .items(List.of(OrderLineContract.builder()
                        .productName("Mint Green Suit Jacket")
                        .option1Label("Size").option1Value("44")
                        .option2Label("Color").option2Value("Teal")
                        .unitPriceCents(75000)
                        .quantity(6)
                        .build()))
                .build();

        String text = composer.compose(order);

        assertThat(text)
                .startsWith("*New Order #TF-20260302-A1B2*")
                .contains("6x *Mint Green Suit Jacket*")
                .contains("   Size: 44 | Color: Teal")
                .contains("   R 750.00 x 6 = R 4,500.00")
                .contains("*Total: R 4,500.00*")
                .contains("Items: 6")
                .contains("*Track:* https://tradefeed.co.za/track/TF-20260302-A1B2")
                .endsWith("Thank you for your order!")
                .doesNotContain("Deliver to");
    }

    @Test
    void compose_SingleUnit_ShowsLineTotalOnly() {
        OrderPlacedContract order = OrderPlacedContract.builder()
                .orderNumber("TF-20260302-A1B2")
                .totalCents(9999)
                .itemCount(1)
                .items(List.of(OrderLineContract.builder()
                        .productName("Cap")
                        .option1Value("One size")
                        .unitPriceCents(9999)
                        .quantity(1)
                        .build()))
                .build();

        String text = composer.compose(order);

        assertThat(text).contains("   Size: One size\n").contains("   R 99.99\n").doesNotContain(" x 1");
    }

    @Test
    void compose_WithAddress_IncludesDeliverySection() {
        OrderPlacedContract order = OrderPlacedContract.builder()
                .orderNumber("TF-20260302-A1B2")
                .totalCents(100)
                .itemCount(1)
                .items(List.of())
                .deliveryAddress("12 Long Street")
                .deliveryCity("Cape Town")
                .deliveryProvince("Western Cape")
                .deliveryPostalCode("8001")
                .build();

        assertThat(composer.compose(order))
                .contains("*Deliver to:*\n   12 Long Street\n   Cape Town, Western Cape 8001");
    }

    @Test
    void formatPrice_MinorUnits_NoFloatingPoint() {
        assertThat(composer.formatPrice(0)).isEqualTo("R 0.00");
        assertThat(composer.formatPrice(5)).isEqualTo("R 0.05");
        assertThat(composer.formatPrice(123456789)).isEqualTo("R 1,234,567.89");
    }
}
