package io.vena.thicket;

import io.vena.thicket.annotations.ActionInput;
import io.vena.thicket.annotations.EntityAction;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static io.vena.thicket.ActionProfile.COMMAND;
import static io.vena.thicket.ActionProfile.ENDPOINT;
import static io.vena.thicket.ActionProfile.QUERY;
import static io.vena.thicket.ActionProfile.TASK;
import static io.vena.thicket.ActionProfile.WORKFLOW;

/**
 * Actions for the user type of {@link AbstractEntityTest}.
 * Counts query invocations so tests can tell a cached result from a fresh one.
 */
public class UserActions {
	public final AtomicInteger queryInvocations = new AtomicInteger();

	@EntityAction(profile = QUERY, description = "Username and age")
	Map<String, Object> summary(Entity user, Map<String, Object> params) {
		queryInvocations.incrementAndGet();
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("username", user.get("username"));
		result.put("age", user.get("age"));
		return result;
	}

	@EntityAction(profile = QUERY)
	Object peekAndTouch(Entity user, Map<String, Object> params) {
		queryInvocations.incrementAndGet();
		user.set("lastPeek", queryInvocations.get());
		return user.get("username");
	}

	@EntityAction(profile = COMMAND, roles = "admin")
	void activate(Entity user, Map<String, Object> params) {
		user.set("active", true);
	}

	@EntityAction(profile = COMMAND, roles = { "admin", "self" })
	@ActionInput(name = "username", type = ValueType.STRING, required = true, minLength = 3, maxLength = 20)
	Object rename(Entity user, Map<String, Object> params) {
		user.set("username", params.get("username"));
		return user.get("username");
	}

	@EntityAction(profile = COMMAND, roles = "admin")
	void setAge(Entity user, Map<String, Object> params) {
		user.set("age", params.get("age"));
	}

	@EntityAction(profile = COMMAND, roles = "admin")
	void audit(Entity user, Map<String, Object> params) throws IOException {
		throw new IOException("audit log unavailable");
	}

	@EntityAction(name = "change-role", profile = ENDPOINT, roles = "admin", description = "Change the user's role")
	@ActionInput(name = "role", type = ValueType.STRING, required = true, enumValues = { "user", "admin" })
	@ActionInput(name = "reason", type = ValueType.STRING, maxLength = 100)
	Object changeRole(Entity user, Map<String, Object> params) {
		user.set("role", params.get("role"));
		return user.get("role");
	}

	@EntityAction(profile = TASK, roles = { "system", "admin" })
	String sendWelcome(Entity user, Map<String, Object> params) {
		return "Welcome sent to " + user.get("username");
	}

	@EntityAction(profile = TASK, roles = "system")
	void export(Entity user, Map<String, Object> params) throws IOException {
		throw new IOException("disk full");
	}

	@EntityAction(profile = WORKFLOW, roles = "admin")
	@ActionInput(name = "fail", type = ValueType.BOOLEAN)
	@ActionInput(name = "failEarly", type = ValueType.BOOLEAN)
	String onboard(Entity user, Map<String, Object> params) throws IOException {
		if (Boolean.TRUE.equals(params.get("failEarly"))) {
			throw new IOException("onboarding service unavailable");
		}
		user.set("active", true);
		user.set("profile.displayName", user.get("username"));
		if (Boolean.TRUE.equals(params.get("fail"))) {
			throw new IOException("mail server down");
		}
		return "onboarded";
	}
}
