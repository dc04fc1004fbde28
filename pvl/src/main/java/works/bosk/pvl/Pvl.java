package works.bosk.pvl;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.pvl.model.PvlContainer;
import works.bosk.pvl.model.PvlModule;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Convenience entry points for the common cases.
 * For anything else, use {@link Dialect#parser()} and {@link Dialect#encoder()},
 * or build a {@link works.bosk.pvl.parser.Parser} and {@link works.bosk.pvl.encoder.Encoder} directly.
 */
public final class Pvl {
	private Pvl() { }

	/**
	 * Reads any dialect, leniently.
	 */
	public static PvlModule decode(@NotNull CharSequence text) {
		return decode(text, Dialect.OMNI);
	}

	public static PvlModule decode(@NotNull CharSequence text, @NotNull Dialect dialect) {
		return dialect.parser().parse(text);
	}

	/**
	 * Decodes the longest prefix of <code>bytes</code> that is valid UTF-8.
	 * Labels are often followed by binary data in the same file, which is ignored.
	 */
	public static PvlModule decode(@NotNull byte[] bytes, @NotNull Dialect dialect) {
		return decode(utf8Prefix(bytes), dialect);
	}

	/**
	 * Reads all of <code>in</code> without closing it.
	 *
	 * @see #decode(byte[], Dialect)
	 */
	public static PvlModule decode(@NotNull InputStream in, @NotNull Dialect dialect) {
		try {
			return decode(in.readAllBytes(), dialect);
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to read PVL input", e);
		}
	}

	public static String encode(@NotNull PvlContainer module) {
		return encode(module, Dialect.PVL);
	}

	/**
	 * @throws IllegalArgumentException if <code>dialect</code> can't encode
	 */
	public static String encode(@NotNull PvlContainer module, @NotNull Dialect dialect) {
		return dialect.encoder().encode(module);
	}

	static String utf8Prefix(byte[] bytes) {
		CharsetDecoder decoder = UTF_8.newDecoder()
			.onMalformedInput(CodingErrorAction.REPORT)
			.onUnmappableCharacter(CodingErrorAction.REPORT);
		ByteBuffer in = ByteBuffer.wrap(bytes);
		CharBuffer out = CharBuffer.allocate(bytes.length);
		CoderResult result = decoder.decode(in, out, true);
		if (result.isError()) {
			LOGGER.debug("Ignoring {} bytes after the first one that isn't UTF-8, at offset {}", bytes.length - in.position(), in.position());
		} else {
			decoder.flush(out);
		}
		out.flip();
		return out.toString();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Pvl.class);
}
