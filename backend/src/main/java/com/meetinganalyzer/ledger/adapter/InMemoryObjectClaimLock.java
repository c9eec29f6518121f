package com.meetinganalyzer.ledger.adapter;

import com.meetinganalyzer.ledger.service.ObjectClaimLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(value = "app.ledger.redis-lock-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryObjectClaimLock implements ObjectClaimLock {

    private final Set<String> claimed = ConcurrentHashMap.newKeySet();

    @Override
    public boolean tryClaim(String objectId) {
        return claimed.add(objectId);
    }

    @Override
    public void release(String objectId) {
        claimed.remove(objectId);
    }
}
