package com.nayem.courier.spring.fixtures;

import com.nayem.courier.core.Lifetime;
import com.nayem.courier.spring.MessageHandler;
import org.springframework.core.annotation.Order;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@MessageHandler(lifetime = Lifetime.SINGLETON)
public class OrderPlacedListener {

    private final List<OrderPlaced> received = new CopyOnWriteArrayList<>();

    @Order(5)
    public void handle(OrderPlaced event) {
        received.add(event);
    }

    public List<OrderPlaced> received() {
        return received;
    }
}
