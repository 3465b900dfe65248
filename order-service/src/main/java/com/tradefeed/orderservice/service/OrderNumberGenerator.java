package com.tradefeed.orderservice.service;

import com.tradefeed.orderservice.config.OrderProperties;
import com.tradefeed.orderservice.exception.OrderNumberExhaustedException;
import com.tradefeed.orderservice.model.Order;
import com.tradefeed.orderservice.repository.OrderRepository;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Random;

/**
 * Allocates public order numbers of the form {@code PREFIX-YYYYMMDD-XXXX}.
 *
 * <p>The suffix is the only unpredictable part of the number and the number is
 * the only credential for public tracking, so it is drawn from a
 * {@link SecureRandom}. The alphabet leaves out 0, O, 1 and I.
 */
@Component
@Slf4j
public class OrderNumberGenerator {

    static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    static final int SUFFIX_LENGTH = 4;

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    private final OrderRepository orderRepository;
    private final OrderProperties orderProperties;
    private final Clock clock;
    private final Random random;

    @Autowired
    public OrderNumberGenerator(OrderRepository orderRepository, OrderProperties orderProperties, Clock clock) {
        this(orderRepository, orderProperties, clock, new SecureRandom());
    }

    OrderNumberGenerator(OrderRepository orderRepository, OrderProperties orderProperties, Clock clock,
                         Random random) {
        this.orderRepository = orderRepository;
        this.orderProperties = orderProperties;
        this.clock = clock;
        this.random = random;
    }

    /**
     * Returns a number not yet used by any persisted order.
     *
     * <p>The date is read once, so every retry keeps the day the checkout
     * started even if the clock passes midnight in between.
     *
     * @throws OrderNumberExhaustedException if every attempt collided
     */
    public String allocate() {
        LocalDate date = LocalDate.now(clock);
        int maxAttempts = orderProperties.getMaxNumberAttempts();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = generate(date);
            if (!orderRepository.existsByOrderNumber(candidate)) {
                return candidate;
            }
            log.warn("Order number collision: candidate={}, attempt={}/{}", candidate, attempt, maxAttempts);
        }

        throw new OrderNumberExhaustedException(maxAttempts);
    }

    String generate(LocalDate date) {
        StringBuilder number = new StringBuilder(orderProperties.getNumberPrefix())
                .append('-')
                .append(date.format(DATE_FORMAT))
                .append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            number.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return number.toString();
    }

    /**
     * True when an insert lost the race for its order number: another checkout
     * committed the same number between the existence check and the flush.
     */
    public static boolean isNumberCollision(DataIntegrityViolationException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation && violation.getConstraintName() != null) {
                return Order.ORDER_NUMBER_CONSTRAINT.equalsIgnoreCase(violation.getConstraintName());
            }
        }
        String message = e.getMessage();
        return message != null && message.contains(Order.ORDER_NUMBER_CONSTRAINT);
    }
}
