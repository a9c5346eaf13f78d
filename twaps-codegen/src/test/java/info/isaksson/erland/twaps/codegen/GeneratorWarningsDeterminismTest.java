package info.isaksson.erland.twaps.codegen;

import info.isaksson.erland.twaps.view.TwapModule;
import info.isaksson.erland.twaps.view.ViewNode;
import info.isaksson.erland.twaps.view.builder.ViewBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static info.isaksson.erland.twaps.view.Views.*;
import static org.junit.jupiter.api.Assertions.*;

public class GeneratorWarningsDeterminismTest {

    // Twelve rows, each a tappable button, so paths cross items[9] -> items[10].
    private static TwapModule rowsWithActions() {
        List<Integer> rows = IntStream.range(0, 12).boxed().collect(Collectors.toList());
        ViewNode list = ViewBuilder.forEach(rows, i -> button(() -> { }, text("Row " + i)));
        return new TwapModule("  ", "2.0\n", "Twaps\r\nTeam", vstack(text("Header"), list));
    }

    @Test
    void generatorWarningsAreGroupedByCodeInReadingOrder() {
        TwapCodeGenerator.Result res = new TwapCodeGenerator(rowsWithActions()).generate();

        List<String> codes = new ArrayList<>();
        for (GeneratorWarning w : res.warnings) codes.add(w.code);
        assertEquals(15, codes.size());
        assertEquals(GeneratorWarning.ACTION_NOT_SERIALIZED, codes.get(0));
        assertEquals(GeneratorWarning.ACTION_NOT_SERIALIZED, codes.get(11));
        assertEquals(GeneratorWarning.BLANK_MODULE_ID, codes.get(12));
        assertEquals(GeneratorWarning.METADATA_LINE_BREAK, codes.get(13));

        assertEquals("/content/content/second/items[0]", res.warnings.get(0).context.get(GeneratorWarnings.PATH));
        assertEquals("/content/content/second/items[2]", res.warnings.get(2).context.get(GeneratorWarnings.PATH));
        assertEquals("/content/content/second/items[10]", res.warnings.get(10).context.get(GeneratorWarnings.PATH));
        assertTrue(res.warnings.get(12).context.isEmpty());
        assertEquals("version", res.warnings.get(13).context.get(GeneratorWarnings.FIELD));
        assertEquals("author", res.warnings.get(14).context.get(GeneratorWarnings.FIELD));
    }

    @Test
    void sameModuleGivesSameWarnings() {
        List<GeneratorWarning> first = new TwapCodeGenerator(rowsWithActions()).generate().warnings;
        List<GeneratorWarning> second = new TwapCodeGenerator(rowsWithActions()).generate().warnings;

        assertEquals(first, second);
    }

    @Test
    void nodeWarningsRequireAPath() {
        GeneratorWarnings w = new GeneratorWarnings();

        assertThrows(IllegalArgumentException.class,
                () -> w.warn(GeneratorWarning.ACTION_NOT_SERIALIZED, "no path", null));
    }

    @Test
    void listIsUnmodifiable() {
        GeneratorWarnings w = new GeneratorWarnings();
        w.warn(GeneratorWarning.BLANK_MODULE_ID, "Module id is blank");

        assertThrows(UnsupportedOperationException.class, () -> w.toDeterministicList().clear());
    }
}
