package de.t14d3.kvstore.mapping;

import de.t14d3.kvstore.annotations.Embeddable;
import de.t14d3.kvstore.annotations.Entity;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

public class EntityScanner {
    private static final Logger log = LoggerFactory.getLogger(EntityScanner.class);

    /**
     * Scans the classpath for all @Entity and @Embeddable types under the given package
     * and preloads their metadata, so mapping errors surface at startup.
     *
     * @return the classes that were found
     */
    public static Set<Class<?>> scan(String basePackage) {
        Reflections reflections = new Reflections(
                new ConfigurationBuilder()
                        .setUrls(ClasspathHelper.forPackage(basePackage))
                        .filterInputsBy(new FilterBuilder().includePackage(basePackage))
                        .setScanners(Scanners.TypesAnnotated)
        );
        Set<Class<?>> mapped = new LinkedHashSet<>();
        mapped.addAll(reflections.getTypesAnnotatedWith(Entity.class));
        mapped.addAll(reflections.getTypesAnnotatedWith(Embeddable.class));
        for (Class<?> cls : mapped) {
            EntityMetadata.of(cls);
        }
        log.debug("Loaded metadata for {} mapped classes under {}", mapped.size(), basePackage);
        return mapped;
    }
}
