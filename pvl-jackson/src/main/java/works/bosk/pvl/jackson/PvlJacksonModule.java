package works.bosk.pvl.jackson;

import com.fasterxml.jackson.annotation.JsonFormat;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.Version;
import tools.jackson.databind.BeanDescription;
import tools.jackson.databind.JacksonModule;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.SerializationConfig;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.ser.Serializers;
import works.bosk.pvl.model.BooleanValue;
import works.bosk.pvl.model.DateTimeValue;
import works.bosk.pvl.model.DateValue;
import works.bosk.pvl.model.EmptyValue;
import works.bosk.pvl.model.IntegerValue;
import works.bosk.pvl.model.NullValue;
import works.bosk.pvl.model.PvlContainer;
import works.bosk.pvl.model.PvlContainer.Entry;
import works.bosk.pvl.model.Quantity;
import works.bosk.pvl.model.RealValue;
import works.bosk.pvl.model.SequenceValue;
import works.bosk.pvl.model.SetValue;
import works.bosk.pvl.model.StringValue;
import works.bosk.pvl.model.TimeValue;
import works.bosk.pvl.model.Value;

/**
 * Writes {@link PvlContainer}s and {@link Value}s as JSON.
 * <p>
 * Containers become objects whose members appear in entry order.
 * A key that occurs more than once becomes a repeated member name,
 * which most JSON readers will collapse to its last occurrence.
 * Dates and times are written as ISO-8601 strings,
 * and a leap second is written as second <code>60</code>.
 * Quantities become <code>{"value":..., "units":...}</code>.
 * The {@link EmptyValue} placeholders of a lenient parse become <code>null</code>.
 * <p>
 * This is one-way: there is no deserializer.
 */
public class PvlJacksonModule extends JacksonModule {

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(new PvlSerializers());
	}

	private static final class PvlSerializers extends Serializers.Base {
		@Override
		public ValueSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription.Supplier beanDescRef, JsonFormat.Value formatOverrides) {
			Class<?> theClass = type.getRawClass();
			if (PvlContainer.class.isAssignableFrom(theClass)) {
				return CONTAINER_SERIALIZER;
			} else if (Value.class.isAssignableFrom(theClass)) {
				return VALUE_SERIALIZER;
			} else {
				return null;
			}
		}
	}

	private static final ValueSerializer<PvlContainer> CONTAINER_SERIALIZER = new ValueSerializer<>() {
		@Override
		public void serialize(PvlContainer value, JsonGenerator gen, SerializationContext serializers) {
			writeContainer(value, gen);
		}
	};

	private static final ValueSerializer<Value> VALUE_SERIALIZER = new ValueSerializer<>() {
		@Override
		public void serialize(Value value, JsonGenerator gen, SerializationContext serializers) {
			writeValue(value, gen);
		}
	};

	static void writeContainer(PvlContainer container, JsonGenerator gen) {
		gen.writeStartObject();
		for (Entry e : container) {
			gen.writeName(e.key());
			writeValue(e.value(), gen);
		}
		gen.writeEndObject();
	}

	static void writeValue(Value value, JsonGenerator gen) {
		if (value instanceof PvlContainer c) {
			writeContainer(c, gen);
		} else if (value instanceof NullValue || value instanceof EmptyValue) {
			gen.writeNull();
		} else if (value instanceof BooleanValue b) {
			gen.writeBoolean(b.value());
		} else if (value instanceof IntegerValue i) {
			gen.writeNumber(i.value());
		} else if (value instanceof RealValue r) {
			gen.writeNumber(r.value());
		} else if (value instanceof StringValue s) {
			gen.writeString(s.value());
		} else if (value instanceof DateValue || value instanceof TimeValue || value instanceof DateTimeValue) {
			gen.writeString(value.toString());
		} else if (value instanceof SequenceValue s) {
			gen.writeStartArray();
			s.values().forEach(v -> writeValue(v, gen));
			gen.writeEndArray();
		} else if (value instanceof SetValue s) {
			gen.writeStartArray();
			s.values().forEach(v -> writeValue(v, gen));
			gen.writeEndArray();
		} else if (value instanceof Quantity q) {
			gen.writeStartObject();
			gen.writeName("value");
			writeValue(q.value(), gen);
			gen.writeName("units");
			gen.writeString(q.units());
			gen.writeEndObject();
		} else {
			throw new IllegalArgumentException("Unexpected value type: " + value.getClass());
		}
	}
}
