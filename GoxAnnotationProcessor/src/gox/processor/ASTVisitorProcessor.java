package gox.processor;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic.Kind;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multimaps;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;
import com.squareup.javapoet.WildcardTypeName;

/**
 * Generates visitor plumbing for {@link ASTNode} classes.
 *
 * <p>For each annotated class {@code Outer.Name} in package {@code p} this writes
 * {@code p.Outer_Name_ASTNode}, and once per package it writes {@code p.ASTVisitor},
 * {@code p.DefaultASTVisitor} and {@code p.VoidDefaultASTVisitor} covering every annotated class
 * of that package. The package must provide {@code ASTNodeInterface} and {@code ASTNodeUtils}.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  private static final TypeVariableName V = TypeVariableName.get("V");

  // Packages whose visitor types were already written; all nodes of a package must arrive in the
  // same round.
  private final Set<String> finishedPackages = new HashSet<>();

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ASTNode.class.getName(), ASTChild.class.getName());
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    if (annotations.isEmpty() || roundEnv.processingOver()) {
      return false;
    }

    ImmutableListMultimap<String, TypeElement> nodesByPackage =
        Multimaps.index(
            roundEnv
                .getElementsAnnotatedWith(ASTNode.class)
                .stream()
                .map(TypeElement.class::cast)
                .sorted(Comparator.comparing(e -> e.getQualifiedName().toString()))
                .collect(ImmutableList.toImmutableList()),
            this::packageName);

    for (String pkg : nodesByPackage.keySet()) {
      ImmutableList<TypeElement> nodes = nodesByPackage.get(pkg);
      if (!finishedPackages.add(pkg)) {
        processingEnv
            .getMessager()
            .printMessage(
                Kind.ERROR, "@ASTNode classes of " + pkg + " must be compiled together", nodes.get(0));
        continue;
      }

      for (TypeElement node : nodes) {
        try {
          writeASTNodeFile(pkg, node);
        } catch (IOException | RuntimeException ex) {
          processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, node);
        }
      }

      try {
        writeVisitorFiles(pkg, nodes);
      } catch (IOException ex) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, nodes.get(0));
      }
    }
    return true;
  }

  private String packageName(Element element) {
    return processingEnv.getElementUtils().getPackageOf(element).getQualifiedName().toString();
  }

  private static String getASTNodeClassName(Element element) {
    Deque<String> elems = new ArrayDeque<>();
    elems.push("ASTNode");
    do {
      if (element.getKind() == ElementKind.CLASS || element.getKind() == ElementKind.INTERFACE) {
        elems.addFirst(element.getSimpleName().toString());
      }
      element = element.getEnclosingElement();
    } while (element.getKind() != ElementKind.PACKAGE);
    return String.join("_", elems);
  }

  // Wildcards stand in for any type parameters, so visitors accept every instantiation.
  private static TypeName visitedType(TypeElement element) {
    ClassName raw = ClassName.get(element);
    if (element.getTypeParameters().isEmpty()) {
      return raw;
    }
    TypeName[] wildcards =
        element
            .getTypeParameters()
            .stream()
            .map(p -> WildcardTypeName.subtypeOf(Object.class))
            .toArray(TypeName[]::new);
    return ParameterizedTypeName.get(raw, wildcards);
  }

  private static ParameterSpec visitorParameter(String pkg) {
    return ParameterSpec.builder(
            ParameterizedTypeName.get(ClassName.get(pkg, "ASTVisitor"), V), "visitor")
        .build();
  }

  private void writeASTNodeFile(String pkg, TypeElement element) throws IOException {
    String interfaceName = getASTNodeClassName(element);
    if (element.getInterfaces().stream().noneMatch(i -> i.toString().endsWith(interfaceName))) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "Missing interface: " + interfaceName, element);
      return;
    }

    ClassName nodeInterface = ClassName.get(pkg, "ASTNodeInterface");
    ClassName nodeUtils = ClassName.get(pkg, "ASTNodeUtils");

    TypeSpec.Builder typeSpecBuilder =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(nodeInterface);

    typeSpecBuilder.addMethod(
        MethodSpec.methodBuilder("accept")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitorParameter(pkg))
            .addParameter(ParameterSpec.builder(V, "value").build())
            .addStatement("return visitor.visit(($T) this, value)", visitedType(element))
            .build());

    MethodSpec.Builder visitChildren =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitorParameter(pkg))
            .addParameter(ParameterSpec.builder(V, "value").build());

    for (Element enclosed : element.getEnclosedElements()) {
      if (enclosed.getKind() != ElementKind.METHOD) continue;
      if (enclosed.getAnnotation(ASTChild.class) == null) continue;
      if (enclosed.getAnnotation(Override.class) == null) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "Missing @Override", enclosed);
      }

      ExecutableElement method = (ExecutableElement) enclosed;
      String name = method.getSimpleName().toString();
      typeSpecBuilder.addMethod(
          MethodSpec.methodBuilder(name)
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());
      visitChildren.addStatement("value = $T.accept($L(), visitor, value)", nodeUtils, name);
    }
    typeSpecBuilder.addMethod(visitChildren.addStatement("return value").build());

    JavaFile.builder(pkg, typeSpecBuilder.build())
        .skipJavaLangImports(true)
        .build()
        .writeTo(processingEnv.getFiler());
  }

  private void writeVisitorFiles(String pkg, List<TypeElement> nodes) throws IOException {
    ClassName visitorName = ClassName.get(pkg, "ASTVisitor");
    ClassName defaultVisitorName = ClassName.get(pkg, "DefaultASTVisitor");

    TypeSpec.Builder visitor =
        TypeSpec.interfaceBuilder(visitorName).addModifiers(Modifier.PUBLIC).addTypeVariable(V);
    TypeSpec.Builder defaultVisitor =
        TypeSpec.classBuilder(defaultVisitorName)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .addTypeVariable(V)
            .addSuperinterface(ParameterizedTypeName.get(visitorName, V));
    TypeSpec.Builder voidVisitor =
        TypeSpec.classBuilder("VoidDefaultASTVisitor")
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .superclass(ParameterizedTypeName.get(defaultVisitorName, ClassName.get(Void.class)));

    for (TypeElement node : nodes) {
      TypeName type = visitedType(node);
      visitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(V)
              .addParameter(type, "node")
              .addParameter(V, "value")
              .build());
      defaultVisitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC)
              .returns(V)
              .addParameter(type, "node")
              .addParameter(V, "value")
              .addStatement("return node.visitChildren(this, value)")
              .build());
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
              .returns(Void.class)
              .addParameter(type, "node")
              .addParameter(Void.class, "value")
              .addStatement("visitImpl(node)")
              .addStatement("return null")
              .build());
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visitImpl")
              .addModifiers(Modifier.PUBLIC)
              .addParameter(type, "node")
              .addStatement("node.visitChildren(this, null)")
              .build());
    }

    for (TypeSpec spec : ImmutableList.of(visitor.build(), defaultVisitor.build(), voidVisitor.build())) {
      JavaFile.builder(pkg, spec).skipJavaLangImports(true).build().writeTo(processingEnv.getFiler());
    }
  }
}
