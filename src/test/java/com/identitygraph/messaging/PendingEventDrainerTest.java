package com.identitygraph.messaging;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.GetResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.rabbit.core.ChannelCallback;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.net.ConnectException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PendingEventDrainer.
 */
@ExtendWith(MockitoExtension.class)
class PendingEventDrainerTest {

    private static final String QUEUE = "graph.engine.queue";

    @Mock
    private RabbitTemplate rabbitTemplate;

    @Mock
    private EventDeliveryHandler deliveryHandler;

    @Mock
    private Channel channel;

    private PendingEventDrainer drainer;

    @BeforeEach
    void setUp() {
        drainer = new PendingEventDrainer(rabbitTemplate, deliveryHandler, QUEUE);
    }

    @Test
    void testProcessPending_StopsAtEmptyQueue() throws Exception {
        runCallbacksOnChannel();
        when(channel.basicGet(QUEUE, false))
            .thenReturn(message(1L, "first"), message(2L, "second"), null);
        when(deliveryHandler.handle(any())).thenReturn(DeliveryOutcome.ACK, DeliveryOutcome.REJECT);

        assertEquals(2, drainer.processPending(PendingEventDrainer.DEFAULT_MAX_MESSAGES));

        verify(channel).basicAck(1L, false);
        verify(channel).basicReject(2L, false);
        verify(channel, times(3)).basicGet(QUEUE, false);
    }

    @Test
    void testProcessPending_RespectsMaximum() throws Exception {
        runCallbacksOnChannel();
        when(channel.basicGet(QUEUE, false)).thenReturn(message(1L, "a"), message(2L, "b"), message(3L, "c"));
        when(deliveryHandler.handle(any())).thenReturn(DeliveryOutcome.ACK);

        assertEquals(2, drainer.processPending(2));

        verify(channel, times(2)).basicGet(QUEUE, false);
    }

    @Test
    void testProcessPending_StopsAfterRequeue() throws Exception {
        runCallbacksOnChannel();
        when(channel.basicGet(QUEUE, false)).thenReturn(message(1L, "failing"), message(2L, "next"));
        when(deliveryHandler.handle(any())).thenReturn(DeliveryOutcome.REQUEUE);

        assertEquals(1, drainer.processPending(PendingEventDrainer.DEFAULT_MAX_MESSAGES));

        verify(channel).basicReject(1L, true);
        verify(channel, times(1)).basicGet(QUEUE, false);
        verify(deliveryHandler, times(1)).handle(any());
    }

    @Test
    void testProcessPending_BrokerUnavailable() {
        when(rabbitTemplate.execute(any()))
            .thenThrow(new AmqpConnectException(new ConnectException("refused")));

        assertEquals(0, drainer.processPending(10));
        verifyNoInteractions(deliveryHandler);
    }

    @SuppressWarnings("unchecked")
    private void runCallbacksOnChannel() {
        when(rabbitTemplate.execute(any())).thenAnswer(invocation -> {
            ChannelCallback<Object> callback = invocation.getArgument(0);
            return callback.doInRabbit(channel);
        });
    }

    private static GetResponse message(long deliveryTag, String body) {
        Envelope envelope = new Envelope(deliveryTag, false, "identity.events", "identity.new");
        return new GetResponse(envelope, null, body.getBytes(), 0);
    }
}
