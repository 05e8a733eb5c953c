package metacpp.lowering.core;

/** C++ 类型包装的种类。 */
public enum WrapperKind {
  POINTER("*"),
  REFERENCE("&"),
  RVALUE_REFERENCE("&&"),
  CONST("const"),
  ARRAY("[]");

  private final String cppSpelling;

  WrapperKind(String cppSpelling) {
    this.cppSpelling = cppSpelling;
  }

  public String spell(String inner) {
    return this == CONST ? "const " + inner : inner + cppSpelling;
  }
}
