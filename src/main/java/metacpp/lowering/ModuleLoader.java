package metacpp.lowering;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import metacpp.lowering.core.SourceModel;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * 从 JSON 读取类型检查后的源模块。节点类型由 {@code kind} 字段区分，未知字段忽略。
 */
public final class ModuleLoader {
  private final ObjectMapper mapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public SourceModel.Module load(Path file) throws IOException {
    return mapper.readValue(file.toFile(), SourceModel.Module.class);
  }

  public SourceModel.Module load(InputStream in) throws IOException {
    return mapper.readValue(in, SourceModel.Module.class);
  }

  public SourceModel.Module loadFromJson(String json) throws IOException {
    return mapper.readValue(json, SourceModel.Module.class);
  }
}
