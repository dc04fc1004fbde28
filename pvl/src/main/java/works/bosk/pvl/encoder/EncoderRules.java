package works.bosk.pvl.encoder;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.bosk.pvl.decoder.Decoder;
import works.bosk.pvl.grammar.Grammar;

/**
 * Layout and dialect settings for an {@link Encoder}.
 * <p>
 * The {@link #getDecoder() decoder} is the one that will be used to read the text back;
 * the encoder refuses to write anything that it would decode differently.
 */
@Value
@Builder(toBuilder = true)
public class EncoderRules {
	@Default Grammar grammar = Grammar.pvl();
	@Default Decoder decoder = Decoder.pvl();
	@Default Conformance conformance = Conformance.PVL;

	/**
	 * Spaces per nesting level.
	 */
	@Default int indent = 2;

	/**
	 * Lines longer than this, including the newline, are wrapped
	 * where a value contains spaces outside quotes.
	 */
	@Default int width = 80;

	/**
	 * Repeat the block name in end-aggregation statements, as in <code>END_GROUP = name</code>.
	 */
	@Default boolean aggregationEnd = true;

	/**
	 * Terminate each statement with the grammar's statement delimiter.
	 */
	@Default boolean endDelimiter = true;

	@Default String newline = "\n";

	/**
	 * Emit a newline after the end statement.
	 */
	@Default boolean newlineAfterEnd = false;

	/**
	 * For {@link Conformance#PDS3}: write offending groups as objects instead of failing.
	 */
	@Default boolean convertGroupsToObjects = true;

	/**
	 * For {@link Conformance#PDS3}: spaces to replace each tab with; zero leaves tabs alone.
	 */
	@Default int tabReplace = 0;

	public static EncoderRules pvl() {
		return PVL;
	}

	public static EncoderRules odl() {
		return ODL;
	}

	public static EncoderRules pds3() {
		return PDS3;
	}

	public static EncoderRules isis() {
		return ISIS;
	}

	private static final EncoderRules PVL = EncoderRules.builder().build();

	private static final EncoderRules ODL = EncoderRules.builder()
		.grammar(Grammar.odl())
		.decoder(Decoder.odl())
		.conformance(Conformance.ODL)
		.endDelimiter(false)
		.newline("\r\n")
		.newlineAfterEnd(true)
		.build();

	private static final EncoderRules PDS3 = ODL.toBuilder()
		.conformance(Conformance.PDS3)
		.tabReplace(4)
		.build();

	private static final EncoderRules ISIS = EncoderRules.builder()
		.grammar(Grammar.isis())
		.decoder(Decoder.isis())
		.endDelimiter(false)
		.build();
}
