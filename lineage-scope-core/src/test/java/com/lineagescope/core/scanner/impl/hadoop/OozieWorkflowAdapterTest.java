package com.lineagescope.core.scanner.impl.hadoop;

import com.lineagescope.core.builder.ExplicitFlowTuple;
import com.lineagescope.core.builder.NormalizedUnit;
import com.lineagescope.core.builder.ScanUnit;
import com.lineagescope.core.model.ProcessType;
import com.lineagescope.core.scanner.AdapterException;
import com.lineagescope.core.scanner.AdapterResult;
import com.lineagescope.core.scanner.AdapterTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Functional tests for {@link OozieWorkflowAdapter}.
 */
class OozieWorkflowAdapterTest extends AdapterTestBase {

    private static final String WORKFLOW = """
        <workflow-app name="daily-orders-wf" xmlns="uri:oozie:workflow:0.5">
          <start to="ingest"/>
          <action name="ingest">
            <shell xmlns="uri:oozie:shell-action:0.3">
              <exec>ingest.sh</exec>
              <argument>--input</argument>
              <argument>/landing/orders</argument>
              <argument>--output=/staging/orders</argument>
            </shell>
            <ok to="split"/>
            <error to="fail"/>
          </action>
          <fork name="split">
            <path start="load_orders"/>
            <path start="load_customers"/>
          </fork>
          <action name="load_orders">
            <hive xmlns="uri:oozie:hive-action:0.5">
              <script>load_orders.hql</script>
              <param>INPUT_DIR=/staging/orders</param>
              <param>TARGET_TABLE=dw.orders</param>
            </hive>
            <ok to="merge"/>
            <error to="fail"/>
          </action>
          <action name="load_customers">
            <spark xmlns="uri:oozie:spark-action:0.2">
              <name>customers</name>
              <class>com.acme.LoadCustomers</class>
              <configuration>
                <property>
                  <name>source.path</name>
                  <value>/staging/customers</value>
                </property>
              </configuration>
            </spark>
            <ok to="merge"/>
            <error to="fail"/>
          </action>
          <join name="merge" to="check"/>
          <decision name="check">
            <switch>
              <case to="report">${wf:conf('report') eq 'true'}</case>
              <default to="end"/>
            </switch>
          </decision>
          <action name="report">
            <java>
              <main-class>com.acme.Report</main-class>
              <arg>src=dw.orders</arg>
            </java>
            <ok to="end"/>
            <error to="fail"/>
          </action>
          <action name="orphan">
            <fs><delete path="/tmp/x"/></fs>
            <ok to="end"/>
            <error to="fail"/>
          </action>
          <kill name="fail">
            <message>failed</message>
          </kill>
          <end name="end"/>
        </workflow-app>
        """;

    private OozieWorkflowAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new OozieWorkflowAdapter();
    }

    @Test
    void parse_withWorkflow_listsActionsInTransitionOrder() throws IOException {
        // Given
        Path file = createFile("daily_orders/oozie/workflow.xml", WORKFLOW);

        // When
        ScanUnit workflow = adapter.parse(file, context).scanUnits().get(0);

        // Then
        assertThat(workflow.name()).isEqualTo("daily_orders");
        assertThat(workflow.type()).isEqualTo(ProcessType.WORKFLOW);
        assertThat(workflow.scanIdentifier()).isEqualTo("hadoop:daily_orders");
        assertThat(workflow.sourcePath()).isEqualTo("daily_orders");
        assertThat(workflow.parameters()).containsEntry("workflow.name", "daily-orders-wf");
        assertThat(workflow.units())
            .extracting(NormalizedUnit::name, NormalizedUnit::roleHint)
            .containsExactly(
                tuple("ingest", "shell"),
                tuple("load_orders", "hive"),
                tuple("load_customers", "spark"),
                tuple("report", "java"),
                tuple("orphan", "fs"));
    }

    @Test
    void parse_withParamsArgumentsAndProperties_extractsDatasets() throws IOException {
        Path file = createFile("daily_orders/oozie/workflow.xml", WORKFLOW);

        List<NormalizedUnit> units = adapter.parse(file, context).scanUnits().get(0).units();

        assertThat(units)
            .extracting(NormalizedUnit::name, NormalizedUnit::inputDatasets, NormalizedUnit::outputDatasets)
            .contains(
                tuple("ingest", List.of("/landing/orders"), List.of("/staging/orders")),
                tuple("load_orders", List.of("/staging/orders"), List.of("dw.orders")),
                tuple("load_customers", List.of("/staging/customers"), List.of()),
                tuple("report", List.of("dw.orders"), List.of()));
    }

    @Test
    void parse_withHiveAction_keepsScriptAsTransformationText() throws IOException {
        Path file = createFile("daily_orders/oozie/workflow.xml", WORKFLOW);

        NormalizedUnit load = adapter.parse(file, context).scanUnits().get(0).units().get(1);

        assertThat(load.transformationText()).isEqualTo("hive: load_orders.hql");
        assertThat(load.parameters())
            .containsEntry("script", "load_orders.hql")
            .containsEntry("param.TARGET_TABLE", "dw.orders");
    }

    @Test
    void parse_withControlNodes_followsOkTransitionsThroughForkJoinAndDecision() throws IOException {
        Path file = createFile("daily_orders/oozie/workflow.xml", WORKFLOW);

        List<ExplicitFlowTuple> flows = adapter.parse(file, context).scanUnits().get(0).explicitFlows();

        assertThat(flows)
            .extracting(ExplicitFlowTuple::sourceName, ExplicitFlowTuple::targetName, ExplicitFlowTuple::flowType)
            .containsExactlyInAnyOrder(
                tuple("ingest", "load_orders", "CONTROL"),
                tuple("ingest", "load_customers", "CONTROL"),
                tuple("load_orders", "report", "CONTROL"),
                tuple("load_customers", "report", "CONTROL"));
    }

    @Test
    void parse_withJobProperties_addsProcessParameters() throws IOException {
        Path file = createFile("daily_orders/oozie/workflow.xml", WORKFLOW);
        createFile("daily_orders/oozie/job.properties", "nameNode=hdfs://nn:8020\nqueueName=etl\n");

        ScanUnit workflow = adapter.parse(file, context).scanUnits().get(0);

        assertThat(workflow.parameters())
            .containsEntry("nameNode", "hdfs://nn:8020")
            .containsEntry("queueName", "etl");
    }

    @Test
    void parse_withNonWorkflowXml_returnsWarningAndNoProcess() throws IOException {
        Path file = createFile("conf/workflow-settings.xml", "<settings><retries>3</retries></settings>");

        AdapterResult result = adapter.parse(file, context);

        assertThat(result.scanUnits()).isEmpty();
        assertThat(result.warnings()).singleElement().asString().contains("Not an Oozie workflow");
    }

    @Test
    void parse_withMalformedXml_throwsAdapterException() throws IOException {
        Path file = createFile("broken/workflow.xml", "<workflow-app><start to=\"a\"></workflow-app");

        assertThatThrownBy(() -> adapter.parse(file, context))
            .isInstanceOf(AdapterException.class)
            .hasMessageContaining("Malformed workflow XML")
            .extracting(e -> ((AdapterException) e).getFile())
            .isEqualTo(file);
    }

    @Test
    void classify_withKeyNames_routesValues() {
        Set<String> inputs = new LinkedHashSet<>();
        Set<String> outputs = new LinkedHashSet<>();

        OozieWorkflowAdapter.classify("--src", "a", inputs, outputs);
        OozieWorkflowAdapter.classify("OUTPUT_PATH", "b", inputs, outputs);
        OozieWorkflowAdapter.classify("dest.table", "c", inputs, outputs);
        boolean classified = OozieWorkflowAdapter.classify("queue", "d", inputs, outputs);

        assertThat(inputs).containsExactly("a");
        assertThat(outputs).containsExactly("b", "c");
        assertThat(classified).isFalse();
    }
}
