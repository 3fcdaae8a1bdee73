package gox;

/** Finds whether a tree contains any element or fragment. */
final class MarkupDetector extends VoidDefaultASTVisitor {
  private boolean found = false;

  static boolean containsMarkup(AST ast) {
    MarkupDetector detector = new MarkupDetector();
    ast.accept(detector, null);
    return detector.found;
  }

  @Override
  public void visitImpl(AST.Element node) {
    found = true;
  }

  @Override
  public void visitImpl(AST.Fragment node) {
    found = true;
  }
}
