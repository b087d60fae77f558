package org.entitybrowser.core.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import org.entitybrowser.core.json.JsonValues;
import org.jetbrains.annotations.NotNull;

import java.util.Comparator;
import java.util.Objects;

/**
 * One dataset entry: the raw JSON tree plus the identifier and type resolved from it at load time.
 *
 * <p>{@code id} is the {@code id} field when non-empty, otherwise the {@code abstract} field, otherwise empty.
 * {@code itemType} is the {@code type} field or empty. Both are derived once by {@link #fromValue(JsonElement)};
 * the tree belongs to the record collection and must not be mutated after the collection is indexed.</p>
 */
public record GameRecord(
		JsonElement value,
		String id,
		String itemType
) {
	/** Dataset order used by the loader: type first, then identifier. */
	public static final Comparator<GameRecord> BY_TYPE_THEN_ID =
			Comparator.comparing(GameRecord::itemType).thenComparing(GameRecord::id);

	public GameRecord {
		value = value == null ? JsonNull.INSTANCE : value;
		Objects.requireNonNull(id, "id");
		Objects.requireNonNull(itemType, "itemType");
	}

	public static GameRecord fromValue(JsonElement value) {
		String id = JsonValues.nonEmptyStringField(value, "id")
				.or(() -> JsonValues.stringField(value, "abstract"))
				.orElse("");
		String itemType = JsonValues.stringField(value, "type").orElse("");
		return new GameRecord(value, id, itemType);
	}

	/**
	 * Top-level {@code category} string, empty when absent or not a string.
	 */
	public String category() {
		return JsonValues.stringField(value, "category").orElse("");
	}

	@NotNull
	@Override
	public String toString() {
		return String.format("GameRecord{id='%s', type='%s'}", id, itemType);
	}
}
