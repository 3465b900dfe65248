package com.tradefeed.orderservice.collaborator;

import com.tradefeed.common.contracts.OrderLineContract;
import com.tradefeed.common.contracts.OrderPlacedContract;
import com.tradefeed.orderservice.config.OrderProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Chat text using the markup every chat client renders: *bold* and plain lines.
 *
 * <pre>
 * *New Order #TF-20260302-A1B2*
 *
 * 6x *Mint Green Suit Jacket*
 *    Size: 44 | Color: Teal
 *    R 750.00 x 6 = R 4,500.00
 *
 * ------------------------
 * *Total: R 4,500.00*
 * Items: 6
 *
 * *Track:* https://tradefeed.co.za/track/TF-20260302-A1B2
 *
 * Thank you for your order!
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class PlainTextOrderChatComposer implements OrderChatComposer {

    private static final String DIVIDER = "------------------------";
    private static final String DEFAULT_OPTION1_LABEL = "Size";
    private static final String DEFAULT_OPTION2_LABEL = "Color";

    private final OrderProperties orderProperties;

    @Override
    public String compose(OrderPlacedContract order) {
        StringBuilder text = new StringBuilder();
        text.append("*New Order #").append(order.getOrderNumber()).append("*\n\n");

        List<OrderLineContract> items = order.getItems() == null ? List.of() : order.getItems();
        for (OrderLineContract item : items) {
            appendLine(text, item);
            text.append('\n');
        }

        text.append(DIVIDER).append('\n');
        text.append("*Total: ").append(formatPrice(order.getTotalCents())).append("*\n");
        text.append("Items: ").append(order.getItemCount());

        if (hasText(order.getDeliveryAddress())) {
            text.append("\n\n*Deliver to:*\n   ").append(order.getDeliveryAddress());
            text.append("\n   ").append(joinNonBlank(order.getDeliveryCity(), order.getDeliveryProvince()));
            if (hasText(order.getDeliveryPostalCode())) {
                text.append(' ').append(order.getDeliveryPostalCode());
            }
        }

        if (hasText(order.getBuyerNote())) {
            text.append("\n\n*Note:* ").append(order.getBuyerNote());
        }

        text.append("\n\n*Track:* ").append(trackingUrl(order.getOrderNumber()));
        text.append("\n\nThank you for your order!");
        return text.toString();
    }

    private void appendLine(StringBuilder text, OrderLineContract item) {
        text.append(item.getQuantity()).append("x *").append(item.getProductName()).append("*\n");

        List<String> options = new ArrayList<>(2);
        if (hasText(item.getOption1Value())) {
            options.add(labelOr(item.getOption1Label(), DEFAULT_OPTION1_LABEL) + ": " + item.getOption1Value());
        }
        if (hasText(item.getOption2Value())) {
            options.add(labelOr(item.getOption2Label(), DEFAULT_OPTION2_LABEL) + ": " + item.getOption2Value());
        }
        if (!options.isEmpty()) {
            text.append("   ").append(String.join(" | ", options)).append('\n');
        }

        long lineTotal = Math.multiplyExact(item.getUnitPriceCents(), (long) item.getQuantity());
        text.append("   ");
        if (item.getQuantity() > 1) {
            text.append(formatPrice(item.getUnitPriceCents()))
                    .append(" x ").append(item.getQuantity())
                    .append(" = ");
        }
        text.append(formatPrice(lineTotal)).append('\n');
    }

    String trackingUrl(String orderNumber) {
        String base = orderProperties.getPublicBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/track/" + orderNumber;
    }

    // Integer arithmetic only: 450000 -> "R 4,500.00"
    String formatPrice(long cents) {
        String sign = cents < 0 ? "-" : "";
        long abs = Math.abs(cents);
        return String.format(Locale.ROOT, "%s %s%,d.%02d",
                orderProperties.getCurrencySymbol(), sign, abs / 100, abs % 100);
    }

    private static String labelOr(String label, String fallback) {
        return hasText(label) ? label : fallback;
    }

    private static String joinNonBlank(String first, String second) {
        if (hasText(first) && hasText(second)) {
            return first + ", " + second;
        }
        return hasText(first) ? first : (hasText(second) ? second : "");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
