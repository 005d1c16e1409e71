package io.vena.thicket.jackson;

import io.vena.thicket.CollectionBundle;
import io.vena.thicket.Entity;
import io.vena.thicket.EntityRuntime;
import io.vena.thicket.EntitySnapshot;
import io.vena.thicket.EntityType;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves and loads entities as JSON files.
 * Parent directories are created as needed.
 */
@RequiredArgsConstructor
public final class EntityFiles {
	private final SnapshotCodec codec;

	public EntityFiles() {
		this(new SnapshotCodec());
	}

	public void save(Entity entity, Path path) throws IOException {
		save(entity, path, true, true);
	}

	public void save(Entity entity, Path path, boolean includeSchema, boolean includeActions) throws IOException {
		EntitySnapshot snapshot = entity.toSnapshot(includeSchema, includeActions);
		createParent(path);
		try (OutputStream out = Files.newOutputStream(path)) {
			codec.writeSnapshot(snapshot, out);
		}
		LOGGER.debug("Saved {} to {}", entity, path);
	}

	/**
	 * @throws io.vena.thicket.exceptions.SnapshotException if the file isn't a valid snapshot of <code>type</code>
	 */
	public Entity load(EntityRuntime runtime, EntityType type, Path path) throws IOException {
		EntitySnapshot snapshot;
		try (InputStream in = Files.newInputStream(path)) {
			snapshot = codec.readSnapshot(in);
		}
		Entity result = runtime.fromSnapshot(type, snapshot);
		LOGGER.debug("Loaded {} from {}", result, path);
		return result;
	}

	public void saveCollection(EntityType type, Collection<Entity> entities, Path path) throws IOException {
		CollectionBundle bundle = CollectionBundle.of(type, entities);
		createParent(path);
		try (OutputStream out = Files.newOutputStream(path)) {
			codec.writeBundle(bundle, out);
		}
		LOGGER.info("Saved {} {} entities to {}", bundle.entityCount(), type.name(), path);
	}

	public List<Entity> loadCollection(EntityRuntime runtime, EntityType type, Path path) throws IOException {
		CollectionBundle bundle;
		try (InputStream in = Files.newInputStream(path)) {
			bundle = codec.readBundle(in);
		}
		List<Entity> result = runtime.importBundle(type, bundle);
		LOGGER.info("Loaded {} {} entities from {}", result.size(), type.name(), path);
		return result;
	}

	private static void createParent(Path path) throws IOException {
		Path parent = path.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EntityFiles.class);
}
