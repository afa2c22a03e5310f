package com.platform.inventory.reconciliation;

import com.platform.inventory.inventory.InMemoryLocalStateRepository;
import com.platform.inventory.inventory.InventoryTransaction;
import com.platform.inventory.inventory.LocalStateRepository;
import com.platform.inventory.model.LocalInstance;
import com.platform.inventory.model.Provider;
import com.platform.inventory.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for OrphanCleaner.
 *
 * Uses the in-memory inventory so rollback of a single orphan can be observed.
 */
@ExtendWith(MockitoExtension.class)
class OrphanCleanerTest {
    
    private static final Provider PROVIDER = new Provider(1L, "pve-1", "rest", "http://pve-1", null, "active");
    
    @Mock
    private ApplicationEventPublisher eventPublisher;
    
    private SimpleMeterRegistry meterRegistry;
    private InMemoryLocalStateRepository repository;
    private OrphanCleaner cleaner;
    
    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        repository = new InMemoryLocalStateRepository();
        cleaner = new OrphanCleaner(repository, new MetricsRegistry(meterRegistry), eventPublisher);
    }
    
    @Nested
    @DisplayName("Successful cleanup")
    class SuccessTests {
        
        @Test
        @DisplayName("Should soft-delete every orphan and remove its port mappings")
        void shouldCleanAllOrphans() {
            // Given
            LocalInstance b = repository.add(2, "b", 1, "running", 2);
            LocalInstance c = repository.add(3, "c", 1, "creating", 1);
            
            // When
            CleanupResult result = cleaner.clean(PROVIDER, List.of(b, c), CancellationToken.none());
            
            // Then
            assertThat(result.processedCount()).isEqualTo(2);
            assertThat(result.cleanedInstances()).isEqualTo(2);
            assertThat(result.cleanedPortMappings()).isEqualTo(3);
            assertThat(result.cleanedInstanceNames()).containsExactly("b", "c");
            assertThat(result.failedInstanceNames()).isEmpty();
            assertThat(result.cancelled()).isFalse();
            
            assertThat(repository.isLive(2)).isFalse();
            assertThat(repository.isLive(3)).isFalse();
            assertThat(repository.portMappingsOf(2)).isZero();
            assertThat(repository.transactionCount()).isEqualTo(2);
            assertThat(meterRegistry.counter("inventory.reconciliation.orphans.cleaned", "provider", "pve-1").count()).isEqualTo(2.0);
        }
        
        @Test
        @DisplayName("Should return an empty result for no orphans")
        void shouldHandleNoOrphans() {
            CleanupResult result = cleaner.clean(PROVIDER, List.of(), CancellationToken.none());
            
            assertThat(result.processedCount()).isZero();
            assertThat(result.cleanedInstanceNames()).isEmpty();
            assertThat(repository.transactionCount()).isZero();
        }
    }
    
    @Nested
    @DisplayName("Partial failure isolation")
    class IsolationTests {
        
        @Test
        @DisplayName("Should keep cleaning other orphans when one soft delete fails")
        void shouldIsolateFailedOrphan() {
            // Given
            LocalInstance b = repository.add(2, "b", 1, "running", 2);
            LocalInstance c = repository.add(3, "c", 1, "creating", 1);
            repository.failSoftDelete(2);
            
            // When
            CleanupResult result = cleaner.clean(PROVIDER, List.of(b, c), CancellationToken.none());
            
            // Then
            assertThat(result.cleanedInstances()).isEqualTo(1);
            assertThat(result.cleanedPortMappings()).isEqualTo(1);
            assertThat(result.cleanedInstanceNames()).containsExactly("c");
            assertThat(result.failedInstanceNames()).containsExactly("b");
            
            assertThat(repository.isLive(2)).isTrue();
            assertThat(repository.portMappingsOf(2)).as("port mapping delete rolled back").isEqualTo(2);
            assertThat(repository.isLive(3)).isFalse();
        }
        
        @Test
        @DisplayName("Should still soft-delete the instance when its port mappings cannot be removed")
        void shouldContinueAfterPortMappingFailure() {
            // Given
            LocalInstance b = repository.add(2, "b", 1, "running", 4);
            repository.failPortMappingDelete(2);
            
            // When
            CleanupResult result = cleaner.clean(PROVIDER, List.of(b), CancellationToken.none());
            
            // Then
            assertThat(result.cleanedInstances()).isEqualTo(1);
            assertThat(result.cleanedPortMappings()).isZero();
            assertThat(result.warningCount()).isEqualTo(1);
            assertThat(repository.isLive(2)).isFalse();
            
            ArgumentCaptor<CleanupWarningEvent> event = ArgumentCaptor.forClass(CleanupWarningEvent.class);
            verify(eventPublisher).publishEvent(event.capture());
            assertThat(event.getValue().instanceId()).isEqualTo(2L);
            assertThat(event.getValue().portMappingsLeft()).isEqualTo(4L);
            assertThat(event.getValue().providerName()).isEqualTo("pve-1");
        }
        
        @Test
        @DisplayName("Should not publish warnings when port mappings are removed")
        void shouldNotWarnOnSuccess() {
            LocalInstance b = repository.add(2, "b", 1, "running", 1);
            
            cleaner.clean(PROVIDER, List.of(b), CancellationToken.none());
            
            verify(eventPublisher, never()).publishEvent(any(Object.class));
        }
    }
    
    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {
        
        @Test
        @DisplayName("Should stop before the next orphan and keep committed work")
        void shouldStopOnCancellation() {
            // Given
            LocalInstance a = repository.add(1, "a", 1, "running", 0);
            LocalInstance b = repository.add(2, "b", 1, "running", 0);
            LocalInstance c = repository.add(3, "c", 1, "running", 0);
            CancellationToken token = new CancellationToken();
            
            OrphanCleaner cancellingCleaner = new OrphanCleaner(
                new CancelAfterFirstTransaction(repository, token), new MetricsRegistry(meterRegistry), eventPublisher);
            
            // When
            CleanupResult result = cancellingCleaner.clean(PROVIDER, List.of(a, b, c), token);
            
            // Then
            assertThat(result.cancelled()).isTrue();
            assertThat(result.cleanedInstanceNames()).containsExactly("a");
            assertThat(repository.isLive(1)).isFalse();
            assertThat(repository.isLive(2)).isTrue();
            assertThat(repository.isLive(3)).isTrue();
        }
        
        @Test
        @DisplayName("Should process nothing when already cancelled")
        void shouldDoNothingWhenCancelledUpFront() {
            LocalInstance a = repository.add(1, "a", 1, "running", 0);
            CancellationToken token = new CancellationToken();
            token.cancel();
            
            CleanupResult result = cleaner.clean(PROVIDER, List.of(a), token);
            
            assertThat(result.cancelled()).isTrue();
            assertThat(result.processedCount()).isZero();
            assertThat(repository.transactionCount()).isZero();
        }
    }
    
    private static final class CancelAfterFirstTransaction implements LocalStateRepository {
        
        private final InMemoryLocalStateRepository delegate;
        private final CancellationToken token;
        
        CancelAfterFirstTransaction(InMemoryLocalStateRepository delegate, CancellationToken token) {
            this.delegate = delegate;
            this.token = token;
        }
        
        @Override
        public List<LocalInstance> findNonTerminalInstances(long providerId) {
            return delegate.findNonTerminalInstances(providerId);
        }
        
        @Override
        public void inTransaction(Consumer<InventoryTransaction> work) {
            delegate.inTransaction(work);
            token.cancel();
        }
    }
}
