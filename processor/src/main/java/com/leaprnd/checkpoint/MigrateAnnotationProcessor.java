package com.leaprnd.checkpoint;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;

import java.io.DataOutputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static com.leaprnd.checkpoint.Migration.getManifestNameOf;
import static com.leaprnd.checkpoint.Migration.isValidIdentifier;
import static java.lang.String.format;
import static java.util.Collections.singleton;
import static javax.lang.model.SourceVersion.latestSupported;
import static javax.lang.model.element.ElementKind.CLASS;
import static javax.lang.model.element.Modifier.ABSTRACT;
import static javax.lang.model.element.Modifier.PUBLIC;
import static javax.tools.Diagnostic.Kind.ERROR;
import static javax.tools.StandardLocation.CLASS_OUTPUT;

public class MigrateAnnotationProcessor extends AbstractProcessor {

	private final HashMap<String, TreeMap<String, String>> classNamesByIdByGroup = new HashMap<>();

	@Override
	public Set<String> getSupportedAnnotationTypes() {
		return singleton(Migrate.class.getCanonicalName());
	}

	@Override
	public SourceVersion getSupportedSourceVersion() {
		return latestSupported();
	}

	@Override
	public synchronized void init(ProcessingEnvironment processingEnv) {
		classNamesByIdByGroup.clear();
		super.init(processingEnv);
	}

	@Override
	public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
		final var messager = processingEnv.getMessager();
		for (final var element : roundEnv.getElementsAnnotatedWith(Migrate.class)) {
			if (element.getKind() != CLASS || element.getModifiers().contains(ABSTRACT)) {
				messager.printMessage(ERROR, "Only concrete classes can be annotated with @Migrate!", element);
				continue;
			}
			if (!element.getModifiers().contains(PUBLIC)) {
				messager.printMessage(ERROR, "Classes annotated with @Migrate must be public!", element);
				continue;
			}
			if (!isMigration(element)) {
				messager.printMessage(ERROR, "Classes annotated with @Migrate must implement Migration!", element);
				continue;
			}
			final var manifest = element.getAnnotation(Migrate.class);
			final var id = manifest.id();
			if (!isValidIdentifier(id)) {
				messager.printMessage(ERROR, format("\"%s\" is not of the form {14 digit timestamp}_{name}!", id), element);
				continue;
			}
			final var classNamesById = classNamesByIdByGroup.computeIfAbsent(manifest.group(), group -> new TreeMap<>());
			final var binaryName = getBinaryNameOf(element);
			final var conflictingClassName = classNamesById.putIfAbsent(id, binaryName);
			if (conflictingClassName != null && !conflictingClassName.equals(binaryName)) {
				messager.printMessage(ERROR, format("%s is already used by %s!", id, conflictingClassName), element);
			}
		}
		if (roundEnv.processingOver()) {
			for (final var entry : classNamesByIdByGroup.entrySet()) {
				writeManifest(entry.getKey(), entry.getValue());
			}
		}
		return true;
	}

	private boolean isMigration(Element element) {
		final var migrationType = processingEnv.getElementUtils().getTypeElement(Migration.class.getCanonicalName());
		return processingEnv.getTypeUtils().isAssignable(element.asType(), migrationType.asType());
	}

	private String getBinaryNameOf(Element element) {
		return processingEnv.getElementUtils().getBinaryName((TypeElement) element).toString();
	}

	private void writeManifest(String group, Map<String, String> classNamesById) {
		final var filer = processingEnv.getFiler();
		try (final var outputStream = new DataOutputStream(filer.createResource(CLASS_OUTPUT, "", getManifestNameOf(group)).openOutputStream())) {
			for (final var entry : classNamesById.entrySet()) {
				outputStream.writeUTF(entry.getKey());
				outputStream.writeUTF(entry.getValue());
			}
		} catch (IOException exception) {
			processingEnv.getMessager().printMessage(ERROR, format("Cannot write %s: %s", getManifestNameOf(group), exception.getMessage()));
		}
	}

}
