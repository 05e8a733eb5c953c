package metacpp.lowering;

import metacpp.lowering.analysis.ExternalMayRaiseTable;
import metacpp.lowering.core.IdentifierGenerator;
import metacpp.lowering.core.LoweredModel;
import metacpp.lowering.core.SourceModel;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static metacpp.lowering.SourceFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * LoweringPipeline 测试：确定性、JSON 往返与文件输出。
 */
public class LoweringPipelineTest {

  @Test
  public void testCompileIsDeterministic() throws IOException {
    SourceModel.Module module = module("m", f(), g(), h());

    String first = LoweredModelWriter.toJson(LoweringPipeline.compile(module, ExternalMayRaiseTable.empty()));
    String second = LoweredModelWriter.toJson(LoweringPipeline.compile(module, ExternalMayRaiseTable.empty()));

    assertEquals(first, second);
  }

  @Test
  public void testLoweredModuleRoundTripsThroughJson() throws IOException {
    LoweredModel.Module lowered = LoweringPipeline.compile(module("m", f(), h()), ExternalMayRaiseTable.empty());
    String json = LoweredModelWriter.toJson(lowered);

    LoweredModel.Module reread = LoweredModelWriter.read(json);

    assertEquals(json, LoweredModelWriter.toJson(reread));
    assertEquals(lowered.functions.size(), reread.functions.size());
  }

  @Test
  public void testCompileJsonMatchesCompile() throws IOException {
    String sourceJson = Files.readString(fixture("raise_and_handle.json"));

    String lowered = LoweringPipeline.compileJson(sourceJson, ExternalMayRaiseTable.empty());
    SourceModel.Module module = new ModuleLoader().loadFromJson(sourceJson);

    assertEquals(LoweredModelWriter.toJson(LoweringPipeline.compile(module, ExternalMayRaiseTable.empty())), lowered);
    assertTrue(lowered.contains("\"IsError\""));
  }

  @Test
  public void testSynthesizedNamesUseUnitPrefix() {
    LoweredModel.Module lowered = LoweringPipeline.compile(module("m", f(), h()), ExternalMayRaiseTable.empty(),
        IdentifierGenerator.forUnit("unit"));

    assertEquals(4, lowered.functions.size());
    assertEquals("f", lowered.functions.get(0).name);
    assertEquals("h", lowered.functions.get(1).name);
    for (LoweredModel.Function synthesized : lowered.functions.subList(2, 4)) {
      assertTrue(synthesized.name.contains("unit"), synthesized.name);
      assertFalse(synthesized.description.isEmpty());
    }
  }

  @Test
  public void testWriteToFile() throws IOException {
    LoweredModel.Module lowered = LoweringPipeline.compile(module("m", f()), ExternalMayRaiseTable.empty());
    Path out = Files.createTempFile("lowered", ".json");
    try {
      LoweredModelWriter.write(lowered, out);
      assertEquals(LoweredModelWriter.toJson(lowered), Files.readString(out));
    } finally {
      Files.deleteIfExists(out);
    }
  }

  private static Path fixture(String name) {
    try {
      return Path.of(LoweringPipelineTest.class.getResource("/fixtures/" + name).toURI());
    } catch (URISyntaxException e) {
      throw new IllegalStateException(e);
    }
  }
}
