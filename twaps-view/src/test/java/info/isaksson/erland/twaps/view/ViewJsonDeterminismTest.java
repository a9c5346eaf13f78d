package info.isaksson.erland.twaps.view;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static info.isaksson.erland.twaps.view.Views.*;
import static org.junit.jupiter.api.Assertions.*;

public class ViewJsonDeterminismTest {

    @Test
    void writeMatchesGoldenModule() throws Exception {
        Path goldenPath = resource("view/golden/hello-module.json");
        String golden = Files.readString(goldenPath, StandardCharsets.UTF_8);

        TwapModule module = ViewJson.readModule(goldenPath);

        // Parse once so the test is resilient to whitespace/pretty-print differences.
        ObjectMapper om = new ObjectMapper();
        JsonNode goldenNode = om.readTree(golden);

        String rendered = ViewJson.toJsonString(module);
        assertEquals(goldenNode, om.readTree(rendered), "Rendered JSON must be semantically equal to golden fixture.");

        Path tmp = Files.createTempFile("viewjson-", ".json");
        ViewJson.write(module, tmp);
        String written = Files.readString(tmp, StandardCharsets.UTF_8);
        assertEquals(goldenNode, om.readTree(written), "Written JSON must be semantically equal to golden fixture.");

        Path tmp2 = Files.createTempFile("viewjson-", ".json");
        ViewJson.write(module, tmp2);
        assertEquals(written, Files.readString(tmp2, StandardCharsets.UTF_8), "Writing twice must produce identical output.");
        assertTrue(written.endsWith("}\n"));
    }

    @Test
    void goldenModuleMatchesBuilderConstruction() throws Exception {
        TwapModule expected = new TwapModule("com.example.helloworld", "1.0.0", "Twaps Team",
                vstack(HorizontalAlignment.LEADING, 12.0,
                        text("Hello, World!").font(FontStyle.TITLE).bold(),
                        OptionalNode.of(text("Subtitle").foregroundColor(NamedColor.SECONDARY)),
                        button("Tap me")));

        assertEquals(expected, ViewJson.readModule(resource("view/golden/hello-module.json")));
    }

    @Test
    void readBackYieldsEqualTreeForEveryKind() throws Exception {
        ViewNode tree = hstack(VerticalAlignment.BOTTOM, 2.5,
                EitherNode.second(text("no").italic()),
                OptionalNode.empty(),
                new ArrayNode(List.of(text("a"), text("b").foregroundColor(ColorSpec.rgb(0.1, 0.2, 0.3, 0.5)))),
                new Tuple2Node(text("x"), vstack(text("y"))));

        ViewNode back = ViewJson.readFromString(ViewJson.toJsonString(tree));

        assertEquals(tree, back);
        assertEquals(ViewJson.toJsonString(tree), ViewJson.toJsonString(back));
    }

    @Test
    void buttonActionIsNeverSerialized() throws Exception {
        ButtonNode withAction = button(() -> { }, text("Go"));

        String json = ViewJson.toJsonString(withAction);
        assertFalse(json.contains("action"), json);

        ButtonNode back = (ButtonNode) ViewJson.readFromString(json);
        assertFalse(back.hasAction());
        assertEquals(withAction, back);
    }

    @Test
    void readModuleRejectsBareNode() throws Exception {
        Path tmp = Files.createTempFile("viewjson-", ".json");
        ViewJson.write(text("not a module"), tmp);

        assertThrows(IOException.class, () -> ViewJson.readModule(tmp));
    }

    private static Path resource(String resourcePath) throws URISyntaxException {
        return Path.of(ViewJsonDeterminismTest.class.getClassLoader().getResource(resourcePath).toURI());
    }
}
