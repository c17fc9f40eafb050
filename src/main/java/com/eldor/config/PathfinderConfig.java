package com.eldor.config;

import com.eldor.pathfinding.AStarPathfinder;
import com.eldor.pathfinding.PathProvider;
import com.eldor.pathfinding.Pathfinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the {@link Pathfinder} facade. Declaring a {@link PathProvider} bean anywhere in the
 * context puts it in front of the built-in search.
 */
@Configuration
@Slf4j
public class PathfinderConfig {

    @Bean
    public Pathfinder pathfinder(AStarPathfinder engine, ObjectProvider<PathProvider> pathProvider) {
        PathProvider provider = pathProvider.getIfUnique();
        if (provider != null) {
            log.info("Using external path provider {} with built-in fallback", provider.getClass().getSimpleName());
        } else {
            log.info("Using built-in A* pathfinder");
        }
        return new Pathfinder(engine, provider);
    }
}
