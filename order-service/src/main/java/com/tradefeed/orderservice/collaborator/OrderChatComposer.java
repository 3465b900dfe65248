package com.tradefeed.orderservice.collaborator;

import com.tradefeed.common.contracts.OrderPlacedContract;

/**
 * Turns a placed order into the text block sent to the seller's chat channel.
 */
public interface OrderChatComposer {

    String compose(OrderPlacedContract order);
}
