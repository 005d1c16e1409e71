package io.vena.thicket;

import java.util.UUID;
import lombok.AccessLevel;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.Value;

@Value
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class EntityIdentity {
	@NonNull String id;
	@NonNull String entityType;

	public static EntityIdentity generate(String entityType) {
		return new EntityIdentity(UUID.randomUUID().toString(), entityType);
	}

	public static EntityIdentity of(String id, String entityType) {
		if (id.isEmpty()) {
			throw new IllegalArgumentException("Entity id can't be empty");
		}
		return new EntityIdentity(id, entityType);
	}

	@Override
	public String toString() {
		return entityType + "#" + id;
	}
}
