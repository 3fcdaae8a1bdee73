package gox;

/** Overloads called by the generated {@code visitChildren} methods, one per child shape. */
public final class ASTNodeUtils {
  public static <V> V accept(ASTNodeInterface node, ASTVisitor<V> visitor, V value) {
    return node.accept(visitor, value);
  }

  public static <V> V accept(
      Iterable<? extends ASTNodeInterface> nodes, ASTVisitor<V> visitor, V value) {
    for (ASTNodeInterface node : nodes) {
      value = accept(node, visitor, value);
    }
    return value;
  }

  private ASTNodeUtils() {}
}
