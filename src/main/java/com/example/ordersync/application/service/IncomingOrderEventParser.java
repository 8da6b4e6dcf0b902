package com.example.ordersync.application.service;

import com.example.ordersync.application.dto.IncomingOrderEventRequest;
import com.example.ordersync.domain.exception.InvalidOrderEventException;
import com.example.ordersync.domain.model.IncomingOrderEvent;
import com.example.ordersync.domain.model.OrderEventName;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a message body into a validated {@link IncomingOrderEvent}.
 * Placed events must carry every order attribute; other events only need the order id.
 */
@Component
public class IncomingOrderEventParser {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public IncomingOrderEventParser(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    /**
     * @throws InvalidOrderEventException if the body is not a well-formed order event
     */
    public IncomingOrderEvent parse(String body) {
        if (body == null || body.isBlank()) {
            throw new InvalidOrderEventException("Message body is empty");
        }

        IncomingOrderEventRequest request;
        try {
            request = objectMapper.readValue(body, IncomingOrderEventRequest.class);
        } catch (JsonProcessingException e) {
            throw new InvalidOrderEventException("Message body is not a valid order event: "
                    + e.getOriginalMessage(), e);
        }
        if (request == null) {
            throw new InvalidOrderEventException("Message body is empty");
        }

        Set<ConstraintViolation<IncomingOrderEventRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String reasons = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new InvalidOrderEventException("Invalid order event: " + reasons);
        }

        OrderEventName eventName = OrderEventName.findByWireName(request.eventName())
                .orElseThrow(() -> new InvalidOrderEventException(
                        "Unknown order event name: " + request.eventName()));

        IncomingOrderEventRequest.EventDataRequest data = request.eventData();
        if (eventName == OrderEventName.PLACED) {
            requireOrderAttributes(data);
        }

        return new IncomingOrderEvent(
                eventName,
                new IncomingOrderEvent.EventData(data.orderId(), data.sku(), data.units(), data.price(),
                        data.userId()),
                request.createdAt(),
                request.updatedAt());
    }

    private void requireOrderAttributes(IncomingOrderEventRequest.EventDataRequest data) {
        List<String> missing = new ArrayList<>();
        if (data.sku() == null) missing.add("sku");
        if (data.units() == null) missing.add("units");
        if (data.price() == null) missing.add("price");
        if (data.userId() == null) missing.add("userId");
        if (!missing.isEmpty()) {
            throw new InvalidOrderEventException(OrderEventName.PLACED.getWireName()
                    + " is missing " + String.join(", ", missing));
        }
    }
}
