package io.vena.thicket;

import java.util.Map;
import org.jetbrains.annotations.Nullable;

@FunctionalInterface
public interface ActionBody {
	@Nullable Object invoke(Entity entity, Map<String, Object> params) throws Exception;
}
