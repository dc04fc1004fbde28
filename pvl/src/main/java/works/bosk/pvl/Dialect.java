package works.bosk.pvl;

import java.util.Optional;
import works.bosk.pvl.decoder.Decoder;
import works.bosk.pvl.encoder.Encoder;
import works.bosk.pvl.encoder.EncoderRules;
import works.bosk.pvl.parser.Leniency;
import works.bosk.pvl.parser.Parser;

/**
 * The named combinations of decoder, parser leniency and encoder rules
 * that correspond to the PVL family of standards.
 */
public enum Dialect {
	/**
	 * CCSDS Parameter Value Language.
	 */
	PVL(Decoder.pvl(), Leniency.STRICT, EncoderRules.pvl()),

	/**
	 * Object Description Language, as used by PDS3 before its label restrictions.
	 */
	ODL(Decoder.odl(), Leniency.STRICT, EncoderRules.odl()),

	/**
	 * PDS3 labels: reads as ODL, writes with the extra PDS restrictions.
	 */
	PDS3(Decoder.odl(), Leniency.STRICT, EncoderRules.pds3()),

	/**
	 * USGS ISIS cube labels.
	 */
	ISIS(Decoder.isis(), Leniency.STRICT, EncoderRules.isis()),

	/**
	 * Reads anything in the family, tolerating common mistakes. Can't encode.
	 */
	OMNI(Decoder.omni(), Leniency.LENIENT, null),
	;

	private final Decoder decoder;
	private final Leniency leniency;
	private final EncoderRules encoderRules;

	Dialect(Decoder decoder, Leniency leniency, EncoderRules encoderRules) {
		this.decoder = decoder;
		this.leniency = leniency;
		this.encoderRules = encoderRules;
	}

	public Decoder decoder() {
		return decoder;
	}

	public Leniency leniency() {
		return leniency;
	}

	public Optional<EncoderRules> encoderRules() {
		return Optional.ofNullable(encoderRules);
	}

	public Parser parser() {
		return new Parser(decoder, leniency);
	}

	/**
	 * @throws IllegalArgumentException if this dialect has no encoding rules
	 */
	public Encoder encoder() {
		if (encoderRules == null) {
			throw new IllegalArgumentException("Dialect " + name() + " cannot encode");
		}
		return new Encoder(encoderRules);
	}
}
