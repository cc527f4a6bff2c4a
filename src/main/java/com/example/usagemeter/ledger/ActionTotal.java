package com.example.usagemeter.ledger;

import com.example.usagemeter.model.UsageAction;

/**
 * One row of a per-action aggregate.
 */
public class ActionTotal {

    private final UsageAction action;
    private final long quantity;
    private final long events;

    public ActionTotal(UsageAction action, long quantity, long events) {
        this.action = action;
        this.quantity = quantity;
        this.events = events;
    }

    public UsageAction getAction() {
        return action;
    }

    public long getQuantity() {
        return quantity;
    }

    public long getEvents() {
        return events;
    }
}
