package com.hftrisk.simulator;

import com.hftrisk.domain.model.Order;
import com.hftrisk.exception.ExecutionException;
import com.hftrisk.oms.ExecutionGateway;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Paper-trading venue. Acknowledges every order immediately with a sequential exchange id
 * ({@code PAPER-1}, {@code PAPER-2}, ...) and keeps working orders until canceled.
 * Never fills.
 */
@Component
public class PaperExecutionGateway implements ExecutionGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperExecutionGateway.class);

    static final String ID_PREFIX = "PAPER-";

    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, String> workingOrders = new ConcurrentHashMap<>();

    @Override
    public String submit(Order order) {
        String exchangeOrderId = ID_PREFIX + sequence.incrementAndGet();
        workingOrders.put(exchangeOrderId, order.getId());
        log.debug("Paper order acknowledged: orderId={}, exchangeOrderId={}, symbol={}",
                order.getId(), exchangeOrderId, order.getSymbol());
        return exchangeOrderId;
    }

    @Override
    public void cancel(String exchangeOrderId) {
        if (workingOrders.remove(exchangeOrderId) == null) {
            throw new ExecutionException("unknown exchange order id: " + exchangeOrderId);
        }
        log.debug("Paper order canceled: exchangeOrderId={}", exchangeOrderId);
    }

    public int workingOrderCount() {
        return workingOrders.size();
    }
}
