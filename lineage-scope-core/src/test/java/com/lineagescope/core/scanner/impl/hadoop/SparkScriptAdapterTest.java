package com.lineagescope.core.scanner.impl.hadoop;

import com.lineagescope.core.builder.NormalizedUnit;
import com.lineagescope.core.builder.ScanUnit;
import com.lineagescope.core.model.Component;
import com.lineagescope.core.model.ComponentRole;
import com.lineagescope.core.model.FlowProvenance;
import com.lineagescope.core.model.FlowType;
import com.lineagescope.core.model.Process;
import com.lineagescope.core.model.Schema;
import com.lineagescope.core.scanner.AdapterResult;
import com.lineagescope.core.scanner.AdapterTestBase;
import com.lineagescope.core.scanner.ScanOrchestrator;
import com.lineagescope.core.scanner.ScanOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Functional tests for {@link SparkScriptAdapter}.
 */
class SparkScriptAdapterTest extends AdapterTestBase {

    private static final String PYSPARK_JOB = """
        from pyspark.sql import SparkSession
        from pyspark.sql.types import StructType, StructField, LongType, StringType, DecimalType

        spark = SparkSession.builder.appName("enrich").getOrCreate()

        schema = StructType([
            StructField("order_id", LongType(), False),
            StructField("customer_id", StringType(), True),
            StructField("amount", DecimalType(12, 2), True),
        ])

        orders = spark.read.schema(schema).parquet("/data/raw/orders")
        customers = spark.table("dw.customers")
        enriched = (orders.join(customers, "customer_id")
                    .where("amount > 0")
                    .withColumn("load_date", current_date()))
        enriched.write.mode("overwrite").parquet("/data/enriched/orders")
        spark.sql("INSERT INTO audit.loads SELECT 'enrich', count(*) FROM staging.enrich_runs")
        """;

    private SparkScriptAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new SparkScriptAdapter();
    }

    @Test
    void parse_withPySparkJob_extractsReadsAndWrites() throws IOException {
        // Given
        Path file = createFile("daily_orders/spark/enrich.py", PYSPARK_JOB);

        // When
        NormalizedUnit unit = adapter.parse(file, context).scanUnits().get(0).units().get(0);

        // Then
        assertThat(unit.name()).isEqualTo("enrich");
        assertThat(unit.roleHint()).isEqualTo("spark");
        assertThat(unit.inputDatasets()).containsExactly("/data/raw/orders", "dw.customers", "staging.enrich_runs");
        assertThat(unit.outputDatasets()).containsExactly("/data/enriched/orders", "audit.loads");
        assertThat(unit.parameters())
            .containsEntry("script", "daily_orders/spark/enrich.py")
            .containsEntry("language", "python")
            .containsEntry("operations", "join, filter, withColumn");
    }

    @Test
    void parse_withStructType_readsSchema() throws IOException {
        Path file = createFile("spark/enrich.py", PYSPARK_JOB);

        Schema schema = adapter.parse(file, context).scanUnits().get(0).units().get(0).schema();

        assertThat(schema.fields())
            .extracting(Schema.Field::name, Schema.Field::type, Schema.Field::nullable, Schema.Field::lengthOrPrecision)
            .containsExactly(
                tuple("order_id", "long", false, null),
                tuple("customer_id", "string", true, null),
                tuple("amount", "decimal", true, 12));
    }

    @Test
    void parse_withScalaJob_followsReaderAndWriterChains() throws IOException {
        Path file = createFile("billing/spark/Invoices.scala", """
            object Invoices {
              def main(args: Array[String]): Unit = {
                val lines = spark.read.format("delta").load("/lake/billing/lines")
                val invoices = lines.groupBy("invoice_id").agg(sum("amount"))
                invoices.write.mode("append").saveAsTable("billing.invoices")
              }
            }
            """);

        NormalizedUnit unit = adapter.parse(file, context).scanUnits().get(0).units().get(0);

        assertThat(unit.inputDatasets()).containsExactly("/lake/billing/lines");
        assertThat(unit.outputDatasets()).containsExactly("billing.invoices");
        assertThat(unit.parameters()).containsEntry("language", "scala");
    }

    @Test
    void parse_withJobInWorkflow_usesWorkflowAsProcess() throws IOException {
        Path file = createFile("daily_orders/spark/enrich.py", PYSPARK_JOB);

        ScanUnit unit = adapter.parse(file, context).scanUnits().get(0);

        assertThat(unit.name()).isEqualTo("daily_orders");
        assertThat(unit.scanIdentifier()).isEqualTo("hadoop:daily_orders");
        assertThat(unit.sourcePath()).isEqualTo("daily_orders");
    }

    @Test
    void parse_withoutDatasets_warns() throws IOException {
        Path file = createFile("spark/util.py", "def add(a, b):\n    return a + b\n");

        AdapterResult result = adapter.parse(file, context);

        assertThat(result.warnings()).singleElement().asString().startsWith("No dataset references found");
    }

    @Test
    void supports_matchesPythonAndScalaUnderSparkDirectories() {
        assertThat(adapter.supports(Path.of("wf/spark/enrich.py"))).isTrue();
        assertThat(adapter.supports(Path.of("wf/spark/jobs/Enrich.scala"))).isTrue();
        assertThat(adapter.supports(Path.of("wf/scripts/enrich.py"))).isFalse();
    }

    @Test
    void scan_withWorkflowSparkAndPig_mergesScriptsIntoWorkflowActions() throws IOException {
        // Given
        createFile("daily_orders/oozie/workflow.xml", """
            <workflow-app name="daily" xmlns="uri:oozie:workflow:0.5">
              <start to="enrich"/>
              <action name="enrich">
                <spark xmlns="uri:oozie:spark-action:0.2">
                  <master>yarn</master>
                  <name>enrich</name>
                  <jar>enrich.py</jar>
                </spark>
                <ok to="clean"/>
                <error to="fail"/>
              </action>
              <action name="clean">
                <pig><script>clean.pig</script></pig>
                <ok to="end"/>
                <error to="fail"/>
              </action>
              <kill name="fail"><message>failed</message></kill>
              <end name="end"/>
            </workflow-app>
            """);
        createFile("daily_orders/spark/enrich.py", PYSPARK_JOB);
        createFile("daily_orders/pig/clean.pig", """
            orders = LOAD '/data/enriched/orders' USING ParquetLoader() AS (order_id:long, amount:double);
            valid = FILTER orders BY amount > 0;
            STORE valid INTO '/data/clean/orders' USING PigStorage(',');
            """);
        ScanOrchestrator orchestrator = new ScanOrchestrator(
            List.of(new OozieWorkflowAdapter(), adapter, new PigScriptAdapter()));

        // When
        ScanOutcome outcome = orchestrator.scan(context);

        // Then
        assertThat(outcome.report().failedFiles()).isEmpty();
        assertThat(outcome.model().processes()).singleElement()
            .extracting(Process::name).isEqualTo("daily_orders");
        assertThat(outcome.model().components()).extracting(Component::name)
            .containsExactlyInAnyOrder("enrich", "clean");

        Component enrich = outcome.model().findComponentsByName("enrich").get(0);
        Component clean = outcome.model().findComponentsByName("clean").get(0);
        assertThat(enrich.role()).isEqualTo(ComponentRole.TRANSFORM);
        assertThat(enrich.inputDatasetNames()).contains("/data/raw/orders", "dw.customers");
        assertThat(enrich.outputDatasetNames()).contains("/data/enriched/orders");
        assertThat(enrich.parameters())
            .containsEntry("jar", "enrich.py")
            .containsEntry("language", "python");
        assertThat(clean.inputDatasetNames()).containsExactly("/data/enriched/orders");
        assertThat(clean.outputDatasetNames()).containsExactly("/data/clean/orders");
        assertThat(clean.parameters()).containsEntry("script", "clean.pig");

        assertThat(outcome.model().flows())
            .filteredOn(flow -> flow.sourceComponentId().equals(enrich.id()))
            .singleElement()
            .satisfies(flow -> {
                assertThat(flow.targetComponentId()).isEqualTo(clean.id());
                assertThat(flow.flowType()).isEqualTo(FlowType.CONTROL);
                assertThat(flow.provenance()).isEqualTo(FlowProvenance.EXPLICIT);
            });
    }
}
