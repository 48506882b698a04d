package com.evoila.lokigate.loki.pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.evoila.lokigate.common.config.GatewayProperties;
import com.evoila.lokigate.store.LogStoreClient;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class ClickHousePatternStoreTest {

  @Mock private LogStoreClient storeClient;
  @Captor private ArgumentCaptor<List<Map<String, Object>>> rowsCaptor;

  private ClickHousePatternStore store;

  @BeforeEach
  void setUp() {
    store = new ClickHousePatternStore(storeClient, new GatewayProperties());
  }

  @Test
  void load_ShouldGroupRowsByPatternAndBucket() {
    // Given
    when(storeClient.query(anyString(), anyMap()))
        .thenReturn(
            Mono.just(
                List.of(
                    Map.of("pattern", "a", "time_bucket", "60", "count", "3"),
                    Map.of("pattern", "a", "time_bucket", "120", "count", "1"),
                    Map.of("pattern", "b", "time_bucket", 60, "count", 2))));

    // When / Then
    StepVerifier.create(store.load(42L, 0, 600))
        .assertNext(
            patterns -> {
              assertThat(patterns.get("a")).containsEntry(60L, 3L).containsEntry(120L, 1L);
              assertThat(patterns.get("b")).containsEntry(60L, 2L);
            })
        .verifyComplete();
  }

  @Test
  void load_ShouldTreatStoreFailureAsNothingStored() {
    when(storeClient.query(anyString(), anyMap()))
        .thenReturn(Mono.error(new IllegalStateException("table missing")));

    StepVerifier.create(store.load(42L, 0, 600))
        .assertNext(patterns -> assertThat(patterns).isEmpty())
        .verifyComplete();
  }

  @Test
  void save_ShouldCreateTableOnceAndInsertRows() {
    // Given
    when(storeClient.query(startsWith("CREATE TABLE IF NOT EXISTS loki_patterns"), anyMap()))
        .thenReturn(Mono.just(List.of(Map.of())));
    when(storeClient.insert(eq("loki_patterns"), anyList())).thenReturn(Mono.empty());
    Map<String, TreeMap<Long, Long>> patterns = Map.of("a", new TreeMap<>(Map.of(60L, 3L)));

    // When
    StepVerifier.create(store.save(7L, patterns)).verifyComplete();
    StepVerifier.create(store.save(7L, patterns)).verifyComplete();

    // Then
    verify(storeClient, times(1)).query(startsWith("CREATE TABLE"), anyMap());
    verify(storeClient, times(2)).insert(eq("loki_patterns"), rowsCaptor.capture());
    assertThat(rowsCaptor.getValue())
        .containsExactly(
            Map.of("query_hash", 7L, "pattern", "a", "time_bucket", 60L, "count", 3L));
  }

  @Test
  void save_ShouldSkipEmptyPatterns() {
    StepVerifier.create(store.save(7L, Map.of())).verifyComplete();

    verifyNoInteractions(storeClient);
  }
}
