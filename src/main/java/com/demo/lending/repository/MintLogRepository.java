package com.demo.lending.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Append-only audit trail of minting events. */
@Slf4j
@Repository
public class MintLogRepository {

    private final List<MintLogEntry> entries = new ArrayList<>();
    private final Clock clock;

    public MintLogRepository() {
        this(Clock.systemUTC());
    }

    MintLogRepository(Clock clock) {
        this.clock = clock;
    }

    public synchronized MintLogEntry append(String user, String token, BigInteger amount) {
        MintLogEntry entry = new MintLogEntry(entries.size() + 1L, user, token, amount, Instant.now(clock));
        entries.add(entry);
        log.debug("Mint log #{}: {} {} to {}", entry.sequence(), amount, token, user);
        return entry;
    }

    public synchronized List<MintLogEntry> all() {
        return List.copyOf(entries);
    }

    public synchronized List<MintLogEntry> byUser(String user) {
        List<MintLogEntry> out = new ArrayList<>();
        for (MintLogEntry e : entries) {
            if (e.user().equals(user)) out.add(e);
        }
        return out;
    }
}
