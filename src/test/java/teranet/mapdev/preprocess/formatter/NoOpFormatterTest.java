package teranet.mapdev.preprocess.formatter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.preprocess.metadata.SimpleMetadata;
import teranet.mapdev.preprocess.model.DataTable;
import teranet.mapdev.preprocess.util.TestDataFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for NoOpFormatter.
 * Tests the pass-through behavior.
 */
class NoOpFormatterTest {

    private NoOpFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new NoOpFormatter();
    }

    @Test
    void testFit_LeavesMetadataUntouched() {
        SimpleMetadata metadata = TestDataFactory.createOrdersMetadata();

        formatter.fit(metadata);

        assertTrue(formatter.isFitted());
        assertEquals(TestDataFactory.createOrdersMetadata().getColumnList(), metadata.getColumnList());
        assertEquals(TestDataFactory.createOrdersMetadata().getDatetimeFormat(), metadata.getDatetimeFormat());
    }

    @Test
    void testConvert_ReturnsSameTable() {
        DataTable table = TestDataFactory.createOrdersTable();

        assertSame(table, formatter.convert(table));
    }

    @Test
    void testReverseConvert_ReturnsSameTable() {
        DataTable table = TestDataFactory.createOrdersTable();

        assertSame(table, formatter.reverseConvert(table));
    }

    @Test
    void testNotFittedByDefault() {
        assertFalse(formatter.isFitted());
        assertEquals("NoOpFormatter", formatter.getName());
    }
}
