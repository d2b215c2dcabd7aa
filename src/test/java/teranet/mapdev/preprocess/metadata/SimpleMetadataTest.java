package teranet.mapdev.preprocess.metadata;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.preprocess.model.ColumnType;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for SimpleMetadata
 */
class SimpleMetadataTest {

    private SimpleMetadata metadata;

    @BeforeEach
    void setUp() {
        metadata = new SimpleMetadata()
                .addColumn("order_date", ColumnType.DISCRETE)
                .addColumn("order_date", ColumnType.DATETIME)
                .addColumn("customer", ColumnType.DISCRETE)
                .addColumn("amount", ColumnType.FLOAT)
                .setDatetimeFormat("order_date", "%Y-%m-%d");
    }

    @Test
    void testColumnsMayHaveSeveralTypes() {
        assertThat(metadata.getDiscreteColumns()).containsExactly("order_date", "customer");
        assertThat(metadata.getDatetimeColumns()).containsExactly("order_date");
        assertThat(metadata.getColumnList()).containsExactlyInAnyOrder("order_date", "customer", "amount");
    }

    @Test
    void testChangeColumnType() {
        metadata.changeColumnType(List.of("order_date"), ColumnType.DISCRETE, ColumnType.DATETIME);

        assertThat(metadata.getDiscreteColumns()).containsExactly("customer");
        assertThat(metadata.getDatetimeColumns()).containsExactly("order_date");
    }

    @Test
    void testChangeColumnType_RejectsColumnNotOfSourceType() {
        assertThatThrownBy(() -> metadata.changeColumnType(
                List.of("customer", "amount"), ColumnType.DISCRETE, ColumnType.DATETIME))
                .isInstanceOf(MetadataException.class)
                .hasMessageContaining("amount");

        // nothing moved
        assertThat(metadata.getDiscreteColumns()).contains("customer");
        assertThat(metadata.getDatetimeColumns()).doesNotContain("customer");
    }

    @Test
    void testChangeColumnType_EmptyIsNoOp() {
        metadata.changeColumnType(Collections.emptyList(), ColumnType.DISCRETE, ColumnType.DATETIME);

        assertThat(metadata.getDiscreteColumns()).containsExactly("order_date", "customer");
    }

    @Test
    void testRemoveColumns() {
        metadata.removeColumns(List.of("order_date", "not_there"));

        assertThat(metadata.getColumnList()).containsExactlyInAnyOrder("customer", "amount");
        assertThat(metadata.getDatetimeFormat()).doesNotContainKey("order_date");
    }

    @Test
    void testAccessorsAreSnapshots() {
        Set<String> discrete = metadata.getDiscreteColumns();

        metadata.addColumn("city", ColumnType.DISCRETE);

        assertThat(discrete).doesNotContain("city");
        assertThatThrownBy(() -> discrete.add("x")).isInstanceOf(UnsupportedOperationException.class);
    }
}
