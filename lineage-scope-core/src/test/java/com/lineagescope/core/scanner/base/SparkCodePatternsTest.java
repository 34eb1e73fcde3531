package com.lineagescope.core.scanner.base;

import com.lineagescope.core.model.Schema;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link SparkCodePatterns}.
 */
class SparkCodePatternsTest {

    @Test
    void datasetReferences_withFormatShortcuts_followClosestReaderOrWriter() {
        SqlPatterns.TableReferences datasets = SparkCodePatterns.datasetReferences("""
            raw = spark.readStream.json("/landing/events")
            raw.writeStream.format("delta").toTable("bronze.events")
            spark.read.csv("/landing/users.csv").write.orc("/bronze/users")
            """);

        assertThat(datasets.reads()).containsExactly("/landing/events", "/landing/users.csv");
        assertThat(datasets.writes()).containsExactly("bronze.events", "/bronze/users");
    }

    @Test
    void datasetReferences_withInsertInto_writesTable() {
        SqlPatterns.TableReferences datasets = SparkCodePatterns.datasetReferences(
            "df.write.insertInto(\"dw.orders\")");

        assertThat(datasets.reads()).isEmpty();
        assertThat(datasets.writes()).containsExactly("dw.orders");
    }

    @Test
    void datasetReferences_withNotebookWidget_ignoresWidgetName() {
        SqlPatterns.TableReferences datasets = SparkCodePatterns.datasetReferences(
            "dbutils.widgets.text(\"env\", \"dev\")\nspark.read.text(\"/logs/app\")");

        assertThat(datasets.reads()).containsExactly("/logs/app");
    }

    @Test
    void embeddedSql_withTripleQuotedString_returnsWholeStatement() {
        String code = "spark.sql(\"\"\"\n  INSERT INTO dw.a\n  SELECT * FROM dw.b\n\"\"\")";

        assertThat(SparkCodePatterns.embeddedSql(code)).singleElement().asString()
            .contains("INSERT INTO dw.a")
            .contains("FROM dw.b");
        assertThat(SparkCodePatterns.datasetReferences(code).reads()).containsExactly("dw.b");
    }

    @Test
    void operations_normalizesWhereToFilter() {
        assertThat(SparkCodePatterns.operations("df.where(x).filter(y).groupBy(\"k\").agg(sum(\"v\"))"))
            .containsExactly("filter", "groupBy", "agg");
    }

    @Test
    void schema_withScalaStructType_readsNullability() {
        Schema schema = SparkCodePatterns.schema("""
            val schema = StructType(Seq(
              StructField("id", LongType, false),
              StructField("label", VarcharType(40), true)
            ))
            """);

        assertThat(schema.fields())
            .extracting(Schema.Field::name, Schema.Field::type, Schema.Field::nullable, Schema.Field::lengthOrPrecision)
            .containsExactly(
                tuple("id", "long", false, null),
                tuple("label", "varchar", true, 40));
    }

    @Test
    void schema_withoutStructType_returnsNull() {
        assertThat(SparkCodePatterns.schema("df = spark.table(\"x\")")).isNull();
    }
}
