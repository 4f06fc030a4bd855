package com.zktune.tunebackend.user;

import com.zktune.tunebackend.event.LedgerEventService;
import com.zktune.tunebackend.event.LedgerEventType;
import com.zktune.tunebackend.shared.Accounts;
import com.zktune.tunebackend.shared.LedgerError;
import com.zktune.tunebackend.shared.LedgerException;
import com.zktune.tunebackend.shared.LedgerTransactions;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Creator and consumer registrations. The two namespaces are independent: one account may be both
 * a creator and a consumer.
 */
@Service
@RequiredArgsConstructor
public class IdentityRegistry {

    private final CreatorRepository creatorRepository;
    private final ConsumerRepository consumerRepository;
    private final LedgerEventService events;
    private final LedgerTransactions tx;

    /**
     * Registers a creator and returns the id assigned to it.
     *
     * @throws LedgerException with {@link LedgerError#ALREADY_REGISTERED} if the account already has a
     *                         creator record; the existing record is left untouched
     */
    public Long registerCreator(String account, String name, String profileRef) {
        String key = Accounts.require(account, "Creator");
        return tx.write(() -> {
            if (creatorRepository.existsByAccount(key)) {
                throw new LedgerException(LedgerError.ALREADY_REGISTERED, "Creator already registered: " + key);
            }
            Creator saved = creatorRepository.save(
                    new Creator(key, Accounts.orEmpty(name), Accounts.orEmpty(profileRef)));

            events.emit(LedgerEventType.CREATOR_REGISTERED, key,
                    "creator #" + saved.getId() + " '" + saved.getName() + "'");
            return saved.getId();
        });
    }

    public void registerConsumer(String account, String name, String profileRef) {
        String key = Accounts.require(account, "Consumer");
        tx.writeVoid(() -> {
            if (consumerRepository.existsByAccount(key)) {
                throw new LedgerException(LedgerError.ALREADY_REGISTERED, "Consumer already registered: " + key);
            }
            Consumer saved = consumerRepository.save(
                    new Consumer(key, Accounts.orEmpty(name), Accounts.orEmpty(profileRef)));

            events.emit(LedgerEventType.CONSUMER_REGISTERED, key, "'" + saved.getName() + "'");
        });
    }

    @Transactional(readOnly = true)
    public boolean isRegisteredCreator(String account) {
        return account != null && creatorRepository.existsByAccount(account.strip());
    }

    @Transactional(readOnly = true)
    public boolean isRegisteredConsumer(String account) {
        return account != null && consumerRepository.existsByAccount(account.strip());
    }

    @Transactional(readOnly = true)
    public Optional<Creator> findCreator(String account) {
        if (account == null) return Optional.empty();
        return creatorRepository.findByAccount(account.strip());
    }

    @Transactional(readOnly = true)
    public Optional<Consumer> findConsumer(String account) {
        if (account == null) return Optional.empty();
        return consumerRepository.findByAccount(account.strip());
    }

    @Transactional(readOnly = true)
    public long creatorCount() {
        return creatorRepository.count();
    }

    @Transactional(readOnly = true)
    public long consumerCount() {
        return consumerRepository.count();
    }
}
