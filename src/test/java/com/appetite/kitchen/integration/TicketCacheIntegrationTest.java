package com.appetite.kitchen.integration;

import com.appetite.kitchen.client.TicketEventPublisher;
import com.appetite.kitchen.client.impl.LoggingTicketEventPublisher;
import com.appetite.kitchen.model.domain.Ticket;
import com.appetite.kitchen.model.dto.OrderItemEvent;
import com.appetite.kitchen.model.dto.TicketEventTypes;
import com.appetite.kitchen.repository.TicketRepository;
import com.appetite.kitchen.service.bootstrap.TicketCacheBootstrapService;
import com.appetite.kitchen.service.bootstrap.WarmResult;
import com.appetite.kitchen.service.cache.TicketStateCache;
import com.appetite.kitchen.service.ticket.TicketService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full context with H2 and Kafka disabled: tickets written through the service land in
 * the repository and the cache, and a forced reload rebuilds the cache from H2.
 */
@SpringBootTest
@DisplayName("Ticket cache integration tests")
class TicketCacheIntegrationTest {

    @Autowired
    private TicketService ticketService;

    @Autowired
    private TicketStateCache ticketStateCache;

    @Autowired
    private TicketRepository ticketRepository;

    @Autowired
    private TicketCacheBootstrapService bootstrapService;

    @Autowired
    private TicketEventPublisher eventPublisher;

    @BeforeEach
    void setUp() {
        ticketRepository.deleteAll();
        ticketStateCache.replaceAll(List.of());
    }

    @Test
    @DisplayName("Should use the logging publisher while Kafka is disabled")
    void shouldUseLoggingPublisher() {
        assertThat(eventPublisher).isInstanceOf(LoggingTicketEventPublisher.class);
    }

    @Test
    @DisplayName("Should write new tickets through to the cache and move them on status change")
    void shouldWriteThrough() {
        Ticket ticket = ticketService.createFromOrderItem(orderItem("bar")).orElseThrow();

        assertThat(ticketStateCache.getByStationCode("bar")).extracting(Ticket::getId).containsExactly(ticket.getId());
        assertThat(ticketRepository.findById(ticket.getId())).isPresent();

        ticketService.changeStatus(ticket.getId(), "started", null, null);

        assertThat(ticketStateCache.getByStatusCode("created")).isEmpty();
        assertThat(ticketStateCache.getByStationAndStatusCode("bar", "started"))
                .extracting(Ticket::getId)
                .containsExactly(ticket.getId());
    }

    @Test
    @DisplayName("Should rebuild the cache from the repository on forced reload")
    void shouldReloadFromRepository() {
        ticketService.createFromOrderItem(orderItem("kitchen"));
        ticketService.createFromOrderItem(orderItem("dessert"));
        ticketStateCache.replaceAll(List.of());

        WarmResult result = bootstrapService.warmFromRepository();

        assertThat(result.source()).isEqualTo(WarmResult.Source.REPOSITORY);
        assertThat(result.tickets()).isEqualTo(2);
        assertThat(ticketStateCache.stats().byStation()).containsOnlyKeys("kitchen", "dessert");
    }

    private static OrderItemEvent orderItem(String station) {
        OrderItemEvent event = new OrderItemEvent();
        event.setEventType(TicketEventTypes.ORDER_ITEM_CREATED);
        event.setOrderId(UUID.randomUUID().toString());
        event.setOrderItemId(UUID.randomUUID().toString());
        event.setMenuItemId(UUID.randomUUID().toString());
        event.setQuantity(1);
        event.setRequiresProduction(true);
        event.setProductionStation(station);
        return event;
    }
}
