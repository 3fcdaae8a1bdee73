package gox.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a syntax tree class. The class must implement the generated {@code <Outer>_<Name>_ASTNode}
 * interface, which supplies {@code accept} and {@code visitChildren}.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface ASTNode {}
