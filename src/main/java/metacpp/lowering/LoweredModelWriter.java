package metacpp.lowering;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import metacpp.lowering.core.LoweredModel;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 降级模块的 JSON 序列化，供外部模板代码生成器读取。
 */
public final class LoweredModelWriter {

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT)
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private LoweredModelWriter() {
    // 工具类，禁止实例化
  }

  public static String toJson(LoweredModel.Module module) throws JsonProcessingException {
    return MAPPER.writeValueAsString(module);
  }

  public static void write(LoweredModel.Module module, Path file) throws IOException {
    MAPPER.writeValue(file.toFile(), module);
  }

  public static LoweredModel.Module read(String json) throws IOException {
    return MAPPER.readValue(json, LoweredModel.Module.class);
  }
}
