package works.bosk.pvl.jackson;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.bosk.pvl.model.PvlContainer;

import static tools.jackson.databind.SerializationFeature.INDENT_OUTPUT;

/**
 * Shortcut for translating a decoded label to JSON with a {@link PvlJacksonModule}.
 */
public final class PvlJson {
	private PvlJson() { }

	/**
	 * @return indented JSON text
	 */
	public static String toJson(@NotNull PvlContainer container) {
		LOGGER.debug("Translating {} entries to JSON", container.size());
		return MAPPER.writeValueAsString(container);
	}

	/**
	 * A mapper with {@link PvlJacksonModule} installed, for callers that want to
	 * write PVL values as part of larger documents.
	 */
	public static ObjectMapper mapper() {
		return MAPPER;
	}

	private static final ObjectMapper MAPPER = JsonMapper.builder()
		.addModule(new PvlJacksonModule())
		.enable(INDENT_OUTPUT)
		.build();

	private static final Logger LOGGER = LoggerFactory.getLogger(PvlJson.class);
}
