package com.lineagescope.core.scanner;

import com.lineagescope.core.scanner.impl.abinitio.AbInitioGraphAdapter;
import com.lineagescope.core.scanner.impl.databricks.AdfPipelineAdapter;
import com.lineagescope.core.scanner.impl.databricks.DatabricksNotebookAdapter;
import com.lineagescope.core.scanner.impl.hadoop.HiveScriptAdapter;
import com.lineagescope.core.scanner.impl.hadoop.OozieCoordinatorAdapter;
import com.lineagescope.core.scanner.impl.hadoop.OozieWorkflowAdapter;
import com.lineagescope.core.scanner.impl.hadoop.PigScriptAdapter;
import com.lineagescope.core.scanner.impl.hadoop.SparkScriptAdapter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Checks the {@code META-INF/services} registration of {@link FormatAdapter} implementations.
 */
class AdapterServiceLoaderTest {

    private static final int EXPECTED_ADAPTER_COUNT = 8;

    @Test
    void serviceLoader_discoversAllRegisteredAdapters() {
        List<FormatAdapter> adapters = ServiceLoader.load(FormatAdapter.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(adapters)
            .as("ServiceLoader should discover all %d registered adapters", EXPECTED_ADAPTER_COUNT)
            .hasSize(EXPECTED_ADAPTER_COUNT);
        assertThat(adapters).extracting(FormatAdapter::getId).doesNotHaveDuplicates();
    }

    @Test
    void discoverAdapters_sortsByPriority() {
        assertThat(ScanOrchestrator.discoverAdapters())
            .extracting(FormatAdapter::getId)
            .containsExactly(
                AbInitioGraphAdapter.ADAPTER_ID,
                OozieCoordinatorAdapter.ADAPTER_ID,
                OozieWorkflowAdapter.ADAPTER_ID,
                HiveScriptAdapter.ADAPTER_ID,
                SparkScriptAdapter.ADAPTER_ID,
                PigScriptAdapter.ADAPTER_ID,
                DatabricksNotebookAdapter.ADAPTER_ID,
                AdfPipelineAdapter.ADAPTER_ID);
    }

    @Test
    void discoveredAdapters_haveMetadata() {
        for (FormatAdapter adapter : ScanOrchestrator.discoverAdapters()) {
            assertThat(adapter.getDisplayName()).as(adapter.getId()).isNotBlank();
            assertThat(adapter.getSupportedFilePatterns()).as(adapter.getId()).isNotEmpty();
            assertThat(adapter.getSystem()).as(adapter.getId()).isNotNull();
        }
    }
}
