package io.vena.thicket.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.thicket.CollectionBundle;
import io.vena.thicket.EntitySnapshot;
import io.vena.thicket.exceptions.SnapshotException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.fasterxml.jackson.core.JsonGenerator.Feature.AUTO_CLOSE_TARGET;
import static com.fasterxml.jackson.core.JsonParser.Feature.AUTO_CLOSE_SOURCE;
import static com.fasterxml.jackson.databind.SerializationFeature.INDENT_OUTPUT;

/**
 * JSON form of {@link EntitySnapshot} and {@link CollectionBundle}.
 *
 * <p>
 * Both are written as their plain mappings, so the JSON layout is exactly
 * the documented snapshot and bundle layout.
 * Malformed JSON, or JSON of the wrong shape, surfaces as {@link SnapshotException};
 * failures of the underlying stream remain {@link IOException}s.
 * Streams passed in are left open.
 */
public final class SnapshotCodec {
	private static final TypeReference<LinkedHashMap<String, Object>> PLAIN_MAPPING = new TypeReference<>() {};

	private final ObjectMapper mapper;

	public SnapshotCodec() {
		this(new ObjectMapper().enable(INDENT_OUTPUT));
	}

	public SnapshotCodec(ObjectMapper mapper) {
		this.mapper = mapper.copy()
			.disable(AUTO_CLOSE_TARGET)
			.disable(AUTO_CLOSE_SOURCE);
	}

	public String toJson(EntitySnapshot snapshot) {
		return writeString(snapshot.toPlainMapping());
	}

	public String toJson(CollectionBundle bundle) {
		return writeString(bundle.toPlainMapping());
	}

	public EntitySnapshot snapshotFromJson(String json) {
		return EntitySnapshot.fromPlainMapping(readString(json));
	}

	public CollectionBundle bundleFromJson(String json) {
		return CollectionBundle.fromPlainMapping(readString(json));
	}

	public void writeSnapshot(EntitySnapshot snapshot, OutputStream out) throws IOException {
		write(snapshot.toPlainMapping(), out);
	}

	public EntitySnapshot readSnapshot(InputStream in) throws IOException {
		return EntitySnapshot.fromPlainMapping(read(in));
	}

	public void writeBundle(CollectionBundle bundle, OutputStream out) throws IOException {
		write(bundle.toPlainMapping(), out);
	}

	public CollectionBundle readBundle(InputStream in) throws IOException {
		return CollectionBundle.fromPlainMapping(read(in));
	}

	private String writeString(Map<String, Object> plain) {
		try {
			return mapper.writeValueAsString(plain);
		} catch (JsonProcessingException e) {
			throw new SnapshotException("Unable to write JSON", e);
		}
	}

	private Map<String, Object> readString(String json) {
		try {
			return mapper.readValue(json, PLAIN_MAPPING);
		} catch (JsonProcessingException e) {
			throw new SnapshotException("Malformed JSON: " + e.getOriginalMessage(), e);
		}
	}

	private void write(Map<String, Object> plain, OutputStream out) throws IOException {
		try {
			mapper.writeValue(out, plain);
		} catch (JsonProcessingException e) {
			throw new SnapshotException("Unable to write JSON", e);
		}
	}

	private Map<String, Object> read(InputStream in) throws IOException {
		try {
			return mapper.readValue(in, PLAIN_MAPPING);
		} catch (JsonProcessingException e) {
			throw new SnapshotException("Malformed JSON: " + e.getOriginalMessage(), e);
		}
	}
}
