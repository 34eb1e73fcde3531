package com.lineagescope.core.scanner.impl.hadoop;

import com.lineagescope.core.builder.NormalizedUnit;
import com.lineagescope.core.builder.ScanUnit;
import com.lineagescope.core.model.Component;
import com.lineagescope.core.model.ComponentRole;
import com.lineagescope.core.model.FlowProvenance;
import com.lineagescope.core.model.Process;
import com.lineagescope.core.model.ProcessType;
import com.lineagescope.core.scanner.AdapterException;
import com.lineagescope.core.scanner.AdapterResult;
import com.lineagescope.core.scanner.AdapterTestBase;
import com.lineagescope.core.scanner.ScanOptions;
import com.lineagescope.core.scanner.ScanOrchestrator;
import com.lineagescope.core.scanner.ScanOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Functional tests for {@link OozieCoordinatorAdapter}.
 */
class OozieCoordinatorAdapterTest extends AdapterTestBase {

    private static final String COORDINATOR = """
        <coordinator-app name="daily-orders-coord" frequency="${coord:days(1)}"
                         start="2024-01-01T02:00Z" end="2025-01-01T02:00Z" timezone="UTC"
                         xmlns="uri:oozie:coordinator:0.4">
          <datasets>
            <dataset name="raw_orders" frequency="${coord:days(1)}" initial-instance="2024-01-01T00:00Z" timezone="UTC">
              <uri-template>/data/raw/orders/${YEAR}${MONTH}${DAY}</uri-template>
            </dataset>
            <dataset name="clean_orders" frequency="${coord:days(1)}" initial-instance="2024-01-01T00:00Z" timezone="UTC">
              <uri-template>/data/clean/orders/${YEAR}${MONTH}${DAY}</uri-template>
            </dataset>
          </datasets>
          <input-events>
            <data-in name="input" dataset="raw_orders"><instance>${coord:current(0)}</instance></data-in>
          </input-events>
          <output-events>
            <data-out name="output" dataset="clean_orders"><instance>${coord:current(0)}</instance></data-out>
          </output-events>
          <action>
            <workflow>
              <app-path>${nameNode}/apps/daily_orders/workflow.xml</app-path>
              <configuration>
                <property><name>queueName</name><value>etl</value></property>
              </configuration>
            </workflow>
          </action>
        </coordinator-app>
        """;

    private OozieCoordinatorAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new OozieCoordinatorAdapter();
    }

    @Test
    void parse_withCoordinator_createsCoordinatorProcessWithSchedule() throws IOException {
        // Given
        Path file = createFile("daily_orders/oozie/coordinator.xml", COORDINATOR);

        // When
        ScanUnit coordinator = adapter.parse(file, context).scanUnits().get(0);

        // Then
        assertThat(coordinator.name()).isEqualTo("daily-orders-coord");
        assertThat(coordinator.type()).isEqualTo(ProcessType.COORDINATOR);
        assertThat(coordinator.scanIdentifier()).isEqualTo("hadoop:daily_orders/oozie/coordinator.xml");
        assertThat(coordinator.parameters())
            .containsEntry("frequency", "${coord:days(1)}")
            .containsEntry("start", "2024-01-01T02:00Z")
            .containsEntry("end", "2025-01-01T02:00Z")
            .containsEntry("timezone", "UTC")
            .containsEntry("app-path", "${nameNode}/apps/daily_orders/workflow.xml")
            .containsEntry("queueName", "etl");
    }

    @Test
    void parse_withEvents_usesDatasetTemplatesAsWorkflowDatasets() throws IOException {
        Path file = createFile("daily_orders/oozie/coordinator.xml", COORDINATOR);

        NormalizedUnit workflow = adapter.parse(file, context).scanUnits().get(0).units().get(0);

        assertThat(workflow.name()).isEqualTo("daily_orders");
        assertThat(workflow.roleHint()).isEqualTo("workflow");
        assertThat(workflow.inputDatasets()).containsExactly("/data/raw/orders/${YEAR}${MONTH}${DAY}");
        assertThat(workflow.outputDatasets()).containsExactly("/data/clean/orders/${YEAR}${MONTH}${DAY}");
    }

    @Test
    void parse_withUndeclaredDataset_warnsAndKeepsName() throws IOException {
        Path file = createFile("coord/coordinator.xml", """
            <coordinator-app name="c" frequency="60" start="2024-01-01T00:00Z" end="2024-02-01T00:00Z" timezone="UTC">
              <input-events><data-in name="in" dataset="missing"/></input-events>
              <action><workflow><app-path>/apps/load</app-path></workflow></action>
            </coordinator-app>
            """);

        AdapterResult result = adapter.parse(file, context);

        assertThat(result.warnings()).singleElement().asString().contains("undeclared dataset 'missing'");
        assertThat(result.scanUnits().get(0).units().get(0).inputDatasets()).containsExactly("missing");
    }

    @Test
    void parse_withNonCoordinatorXml_returnsWarningAndNoProcess() throws IOException {
        Path file = createFile("config/coordinator-defaults.xml", "<configuration><property/></configuration>");

        AdapterResult result = adapter.parse(file, context);

        assertThat(result.scanUnits()).isEmpty();
        assertThat(result.warnings()).singleElement().asString().startsWith("Not an Oozie coordinator");
    }

    @Test
    void parse_withMalformedXml_throwsAdapterException() throws IOException {
        Path file = createFile("coord/coordinator.xml", "<coordinator-app name=\"c\"><action>");

        assertThatThrownBy(() -> adapter.parse(file, context))
            .isInstanceOf(AdapterException.class)
            .hasMessageContaining("Malformed coordinator XML");
    }

    @Test
    void workflowName_usesLastLiteralPathSegment() {
        assertThat(OozieCoordinatorAdapter.workflowName("${nameNode}/apps/daily_orders/")).isEqualTo("daily_orders");
        assertThat(OozieCoordinatorAdapter.workflowName("${wfPath}")).isEqualTo("workflow");
        assertThat(OozieCoordinatorAdapter.workflowName(null)).isEqualTo("workflow");
    }

    @Test
    void scan_withCoordinatorAndUpstreamJob_connectsAcrossProcesses() throws IOException {
        // Given
        createFile("daily_orders/oozie/coordinator.xml", COORDINATOR);
        createFile("ingest/hive/stage.hql", "LOAD DATA INPATH '/data/clean/orders/${YEAR}${MONTH}${DAY}' "
            + "INTO TABLE staging.orders;");
        ScanOrchestrator orchestrator = new ScanOrchestrator(List.of(adapter, new HiveScriptAdapter()));

        // When
        ScanOutcome outcome = orchestrator.scan(createContext(ScanOptions.defaults().withCrossProcessLineage(true)));

        // Then
        assertThat(outcome.model().processes())
            .extracting(Process::type)
            .containsExactlyInAnyOrder(ProcessType.COORDINATOR, ProcessType.WORKFLOW);
        Component workflow = outcome.model().findComponentsByName("daily_orders").get(0);
        Component stage = outcome.model().findComponentsByName("stage").get(0);
        assertThat(workflow.role()).isEqualTo(ComponentRole.TRANSFORM);
        assertThat(outcome.model().flows())
            .filteredOn(flow -> flow.sourceComponentId().equals(workflow.id()))
            .singleElement()
            .satisfies(flow -> {
                assertThat(flow.targetComponentId()).isEqualTo(stage.id());
                assertThat(flow.datasetName()).isEqualTo("/data/clean/orders/${YEAR}${MONTH}${DAY}");
                assertThat(flow.provenance()).isEqualTo(FlowProvenance.DATASET_MATCH);
            });
    }
}
