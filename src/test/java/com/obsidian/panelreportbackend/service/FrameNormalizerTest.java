package com.obsidian.panelreportbackend.service;

import com.obsidian.panelreportbackend.model.FieldSchema;
import com.obsidian.panelreportbackend.model.Frame;
import com.obsidian.panelreportbackend.model.PanelDescriptor;
import com.obsidian.panelreportbackend.model.QueryResponse;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class FrameNormalizerTest {

    private final FrameNormalizer normalizer = new FrameNormalizer(new TimestampFormatter(ZoneOffset.UTC));

    @Test
    public void testTransposeAndFormatTimestamps() {
        Frame frame = frame(Arrays.asList("Time", "Value"),
                Arrays.asList(1700000000000L, 1700000060000L),
                Arrays.asList(42, 43));

        NormalizedTable table = normalizer.normalize(response("A", frame), panel());

        Assertions.assertEquals(Arrays.asList("Time", "Value"), table.getFields());
        Assertions.assertEquals(2, table.getRows().size());
        Assertions.assertEquals(Arrays.asList("2023-11-14 22:13:20", 42), table.getRows().get(0));
        Assertions.assertEquals(Arrays.asList("2023-11-14 22:14:20", 43), table.getRows().get(1));
    }

    @Test
    public void testShortestColumnWins() {
        Frame frame = frame(Arrays.asList("Term", "Count"),
                Arrays.asList("a", "b", "c"),
                Arrays.asList(1, 2));

        NormalizedTable table = normalizer.normalize(response("A", frame), panel());

        Assertions.assertEquals(2, table.getRows().size());
    }

    @Test
    public void testMissingFieldNameUsesIndex() {
        Frame frame = frame(Arrays.asList("Term", null), Arrays.asList("a"), Arrays.asList(1));

        NormalizedTable table = normalizer.normalize(response("A", frame), panel());

        Assertions.assertEquals(Arrays.asList("Term", "f1"), table.getFields());
    }

    @Test
    public void testRowsOfAllFramesAppended() {
        Frame first = frame(Arrays.asList("Term", "Count"), Arrays.asList("a"), Arrays.asList(1));
        Frame second = frame(Arrays.asList("Other", "Sum"), Arrays.asList("b", "c"), Arrays.asList(2, 3));

        NormalizedTable table = normalizer.normalize(response("A", first, second), panel());

        // 字段只取第一个帧
        Assertions.assertEquals(Arrays.asList("Term", "Count"), table.getFields());
        Assertions.assertEquals(3, table.getRows().size());
        Assertions.assertEquals(Arrays.asList("c", 3), table.getRows().get(2));
        Assertions.assertEquals(2, table.getFrames().size());
    }

    @Test
    public void testNonColumnarFrameSkipped() {
        Frame broken = new Frame();
        broken.getFields().add(new FieldSchema("Term", null));
        broken.getValues().add("not-a-list");
        Frame good = frame(Arrays.asList("Term"), Arrays.asList("x"));

        NormalizedTable table = normalizer.normalize(response("A", broken, good), panel());

        Assertions.assertEquals(List.of("Term"), table.getFields());
        Assertions.assertEquals(1, table.getRows().size());
    }

    @Test
    public void testPrimaryRefIdPreferred() {
        QueryResponse response = new QueryResponse();
        response.getFramesByRefId().put("B", List.of(frame(Arrays.asList("b"), Arrays.asList(1))));
        response.getFramesByRefId().put("A", List.of(frame(Arrays.asList("a"), Arrays.asList(2))));

        NormalizedTable table = normalizer.normalize(response, panel());

        Assertions.assertEquals(List.of("a"), table.getFields());
    }

    @Test
    public void testFallsBackToFirstRefId() {
        QueryResponse response = new QueryResponse();
        response.getFramesByRefId().put("C", List.of(frame(Arrays.asList("c"), Arrays.asList(1))));
        response.getFramesByRefId().put("D", List.of(frame(Arrays.asList("d"), Arrays.asList(2))));

        NormalizedTable table = normalizer.normalize(response, panel());

        Assertions.assertEquals(List.of("c"), table.getFields());
    }

    @Test
    public void testNoFramesGivesEmptyTable() {
        NormalizedTable table = normalizer.normalize(new QueryResponse(), panel());

        Assertions.assertTrue(table.getFields().isEmpty());
        Assertions.assertTrue(table.getRows().isEmpty());
        Assertions.assertTrue(table.getFrames().isEmpty());
    }

    @Test
    public void testTimestampFormatterThreshold() {
        TimestampFormatter formatter = new TimestampFormatter(ZoneOffset.UTC);

        Assertions.assertEquals(1000000000000L, formatter.format(1000000000000L));
        Assertions.assertEquals("2023-11-14 22:13:20", formatter.format(1.7E12));
        Assertions.assertEquals("text", formatter.format("text"));
        Assertions.assertNull(formatter.format(null));
    }

    @Test
    public void testTimestampFormatterLeavesOutOfRangeValues() {
        TimestampFormatter formatter = new TimestampFormatter(ZoneOffset.UTC);
        BigInteger huge = BigInteger.ONE.shiftLeft(70);

        Assertions.assertSame(huge, formatter.format(huge));
        Assertions.assertEquals(1.0E30, formatter.format(1.0E30));
        Assertions.assertEquals("2023-11-14 22:13:20", formatter.format(BigInteger.valueOf(1_700_000_000_000L)));
    }

    private static PanelDescriptor panel() {
        PanelDescriptor panel = new PanelDescriptor();
        panel.setId(1);
        panel.setTitle("Events");
        return panel;
    }

    private static QueryResponse response(String refId, Frame... frames) {
        QueryResponse response = new QueryResponse();
        response.getFramesByRefId().put(refId, Arrays.asList(frames));
        return response;
    }

    private static Frame frame(List<String> names, List<?>... columns) {
        Frame frame = new Frame();
        for (String name : names) {
            frame.getFields().add(new FieldSchema(name, null));
        }
        frame.getValues().addAll(new ArrayList<>(Arrays.asList(columns)));
        return frame;
    }
}
