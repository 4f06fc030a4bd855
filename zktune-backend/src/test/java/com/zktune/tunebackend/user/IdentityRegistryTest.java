package com.zktune.tunebackend.user;

import com.zktune.tunebackend.event.LedgerEventService;
import com.zktune.tunebackend.event.LedgerEventType;
import com.zktune.tunebackend.shared.DirectTransactions;
import com.zktune.tunebackend.shared.LedgerError;
import com.zktune.tunebackend.shared.LedgerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class IdentityRegistryTest {

    private CreatorRepository creatorRepository;
    private ConsumerRepository consumerRepository;
    private LedgerEventService events;
    private IdentityRegistry registry;

    @BeforeEach
    void setUp() {
        creatorRepository = mock(CreatorRepository.class);
        consumerRepository = mock(ConsumerRepository.class);
        events = mock(LedgerEventService.class);
        registry = new IdentityRegistry(creatorRepository, consumerRepository, events, DirectTransactions.create());
    }

    @Test
    void shouldRegisterCreatorAndReturnAssignedId() {
        when(creatorRepository.existsByAccount("artist.eth")).thenReturn(false);
        when(creatorRepository.save(any())).thenAnswer(i -> {
            Creator c = i.getArgument(0);
            c.setId(7L);
            return c;
        });

        Long id = registry.registerCreator("artist.eth", "Artist", "profiles/a.json");

        assertEquals(7L, id);
        verify(events).emit(eq(LedgerEventType.CREATOR_REGISTERED), eq("artist.eth"), anyString());
    }

    @Test
    void shouldRejectDuplicateCreatorWithoutOverwriting() {
        when(creatorRepository.existsByAccount("artist.eth")).thenReturn(true);

        LedgerException e = assertThrows(LedgerException.class,
                () -> registry.registerCreator("artist.eth", "Other Name", "other.json"));

        assertEquals(LedgerError.ALREADY_REGISTERED, e.getError());
        verify(creatorRepository, never()).save(any());
        verifyNoInteractions(events);
    }

    @Test
    void shouldRejectDuplicateConsumer() {
        when(consumerRepository.existsByAccount("fan.eth")).thenReturn(true);

        LedgerException e = assertThrows(LedgerException.class,
                () -> registry.registerConsumer("fan.eth", "Fan", ""));

        assertEquals(LedgerError.ALREADY_REGISTERED, e.getError());
        verify(consumerRepository, never()).save(any());
    }

    @Test
    void shouldAcceptEmptyNameSinceRegistrationIsKeyedByAccount() {
        when(consumerRepository.existsByAccount("fan.eth")).thenReturn(false);
        when(consumerRepository.save(any())).thenAnswer(i -> i.getArgument(0));

        registry.registerConsumer("fan.eth", "", null);

        verify(consumerRepository).save(argThat(c -> c.getName().isEmpty() && c.getProfileRef().isEmpty()));
        verify(events).emit(eq(LedgerEventType.CONSUMER_REGISTERED), eq("fan.eth"), anyString());
    }

    @Test
    void shouldRejectBlankAccount() {
        assertThrows(IllegalArgumentException.class, () -> registry.registerCreator("  ", "n", "p"));
        assertThrows(IllegalArgumentException.class, () -> registry.registerConsumer(null, "n", "p"));
        verifyNoInteractions(creatorRepository, consumerRepository);
    }

    @Test
    void shouldKeepCreatorAndConsumerNamespacesApart() {
        when(creatorRepository.existsByAccount("both.eth")).thenReturn(true);
        when(consumerRepository.existsByAccount("both.eth")).thenReturn(false);

        assertTrue(registry.isRegisteredCreator("both.eth"));
        assertFalse(registry.isRegisteredConsumer("both.eth"));
        assertFalse(registry.isRegisteredCreator(null));
    }
}
