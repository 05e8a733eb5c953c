package metacpp.lowering;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import metacpp.lowering.analysis.ExternalMayRaiseTable;
import metacpp.lowering.core.LoweredModel;
import metacpp.lowering.core.SourceModel;
import metacpp.lowering.runtime.DataValue;
import metacpp.lowering.runtime.Outcome;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 夹具测试 - 从 test/resources/fixtures 读取源模块 JSON，完整降级后执行
 *
 * 每个夹具可带一个 {@code expectations} 对象（加载器忽略该字段）：
 * - mayRaise: 分析后各源函数的可抛出性
 * - calls: 函数调用及期望值（value）或期望的异常类型名（error）
 *
 * 顶层断言总是执行，断言失败即测试失败。
 */
public class ModuleLoaderTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static Path fixturesDir() throws URISyntaxException {
    return Paths.get(ModuleLoaderTest.class.getResource("/fixtures").toURI());
  }

  @TestFactory
  Stream<DynamicTest> fixtures() throws IOException, URISyntaxException {
    List<DynamicTest> tests = new ArrayList<>();
    try (Stream<Path> paths = Files.list(fixturesDir())) {
      paths
        .filter(p -> p.getFileName().toString().endsWith(".json"))
        .sorted()
        .forEach(path -> {
          String testName = path.getFileName().toString().replace(".json", "");
          tests.add(DynamicTest.dynamicTest(testName, () -> runFixture(path)));
        });
    }
    assertFalse(tests.isEmpty(), "no fixtures found");
    return tests.stream();
  }

  private void runFixture(Path path) throws IOException {
    SourceModel.Module source = new ModuleLoader().load(path);
    JsonNode expectations = MAPPER.readTree(path.toFile()).path("expectations");

    LoweredModel.Module lowered = LoweringPipeline.compile(source, ExternalMayRaiseTable.empty());

    Iterator<Map.Entry<String, JsonNode>> flags = expectations.path("mayRaise").fields();
    while (flags.hasNext()) {
      Map.Entry<String, JsonNode> flag = flags.next();
      LoweredModel.Function function = lowered.function(flag.getKey());
      assertNotNull(function, "missing function " + flag.getKey());
      assertEquals(flag.getValue().asBoolean(), function.mayRaise, "mayRaise of " + flag.getKey());
    }

    LoweredProgram program = LoweredProgram.build(lowered);
    program.runToplevel();

    for (JsonNode call : expectations.path("calls")) {
      String name = call.get("function").asText();
      List<Object> args = new ArrayList<>();
      for (JsonNode arg : call.path("args")) {
        args.add(toValue(arg));
      }
      Outcome outcome = program.call(name, args.toArray());
      if (call.has("error")) {
        assertTrue(outcome.isError(), name + args + " should fail");
        assertEquals(call.get("error").asText(), ((DataValue) outcome.getError()).getTypeName());
      } else {
        assertFalse(outcome.isError(), name + args + " failed with " + outcome.getError());
        assertEquals(toValue(call.get("value")), outcome.getValue(), name + args);
      }
    }
  }

  // 整数统一为 Long，数组为 List
  private static Object toValue(JsonNode node) {
    if (node.isBoolean()) {
      return node.booleanValue();
    } else if (node.isIntegralNumber()) {
      return node.longValue();
    } else if (node.isArray()) {
      List<Object> values = new ArrayList<>();
      for (JsonNode elem : node) {
        values.add(toValue(elem));
      }
      return values;
    } else if (node.isTextual()) {
      return node.textValue();
    }
    throw new IllegalArgumentException("Unsupported fixture value: " + node);
  }

  @Test
  public void testLoadIgnoresUnknownFields() throws IOException {
    String json = "{\"name\":\"m\",\"customTypes\":[],\"functions\":[],\"assertions\":[],"
        + "\"publicNames\":[],\"sourceFile\":\"m.py\"}";
    SourceModel.Module module = new ModuleLoader().loadFromJson(json);

    assertEquals("m", module.name);
    assertTrue(module.functions.isEmpty());
  }

  @Test
  public void testLoadRejectsUnknownKind() {
    String json = "{\"name\":\"m\",\"customTypes\":[],\"assertions\":[],\"publicNames\":[],"
        + "\"functions\":[{\"name\":\"f\",\"params\":[],\"returnType\":{\"kind\":\"Int\"},"
        + "\"body\":[{\"kind\":\"While\"}]}]}";

    assertThrows(IOException.class, () -> new ModuleLoader().loadFromJson(json));
  }

  @Test
  public void testLoadFromClasspathStream() throws IOException {
    try (var in = ModuleLoaderTest.class.getResourceAsStream("/fixtures/type_match.json")) {
      SourceModel.Module module = new ModuleLoader().load(in);
      assertEquals("type_match", module.name);
      assertEquals(1, module.functions.size());
      assertEquals(2, module.assertions.size());
    }
  }
}
