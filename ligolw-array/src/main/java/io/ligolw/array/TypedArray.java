package io.ligolw.array;

import io.ligolw.Array;
import io.ligolw.Dim;
import io.ligolw.Stream;
import io.ligolw.exceptions.UnknownTypeException;
import io.ligolw.types.ScalarType;
import io.ligolw.types.StorageKind;
import io.ligolw.types.TypeClassifier;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * An {@link Array} element that owns a {@link NumericArray} holding its values.
 * <p>
 * When read from a document, the values arrive through an {@link ArrayStream} child,
 * which allocates the array when it receives its first character data
 * (by which time all the {@link Dim} children are known) and fills it in.
 * See {@link State} for the lifecycle.
 * <p>
 * An array built by {@link #fromArray} starts out {@link State#COMPLETE COMPLETE}.
 */
public class TypedArray extends Array {
	public enum State {
		/**
		 * No values have been read, and there is no {@link NumericArray} yet.
		 */
		EMPTY,

		/**
		 * The {@link NumericArray} exists and is being filled from the stream.
		 */
		ALLOCATED,

		/**
		 * All the values have been read, or the array was supplied directly.
		 */
		COMPLETE,
	}

	private final ScalarType scalarType;
	private final ArraySettings settings;
	private State state = State.EMPTY;
	private @Nullable NumericArray array;

	public TypedArray(Map<String, String> attributes) {
		this(attributes, ArraySettings.DEFAULT);
	}

	/**
	 * @throws UnknownTypeException if the {@code Type} attribute is missing or not a numeric type
	 */
	public TypedArray(Map<String, String> attributes, ArraySettings settings) {
		super(attributes);
		this.scalarType = TypeClassifier.storageScalarType(type());
		this.settings = requireNonNull(settings);
	}

	public static TypedArray fromArray(String name, NumericArray array) {
		return fromArray(name, array, null, ArraySettings.DEFAULT);
	}

	/**
	 * Builds a complete {@code Array} subtree around an existing array,
	 * with one {@link Dim} per dimension and an {@link ArrayStream} ready to write the values.
	 * The array is not copied.
	 *
	 * @param dimNames the {@code Name} attributes for the {@link Dim} children in document order,
	 *                 or null to omit them
	 */
	public static TypedArray fromArray(String name, NumericArray array, @Nullable List<String> dimNames, ArraySettings settings) {
		int[] dimensions = Shapes.dimensionsFromShape(array.shape());
		if (dimNames != null && dimNames.size() != dimensions.length) {
			throw new IllegalArgumentException("Expected " + dimensions.length + " dimension names; got " + dimNames.size());
		}

		Map<String, String> attributes = new LinkedHashMap<>();
		attributes.put(NAME, requireNonNull(name));
		attributes.put(TYPE, TypeClassifier.nameFor(array.type()));
		TypedArray result = new TypedArray(attributes, settings);
		for (int i = 0; i < dimensions.length; i++) {
			result.appendChild(new Dim(dimNames == null? null : dimNames.get(i), dimensions[i]));
		}

		Map<String, String> streamAttributes = new LinkedHashMap<>();
		streamAttributes.put(Stream.TYPE, Stream.LOCAL);
		streamAttributes.put(Stream.DELIMITER, settings.delimiter());
		result.appendChild(new ArrayStream(streamAttributes));

		result.array = array;
		result.state = State.COMPLETE;
		return result;
	}

	public ScalarType scalarType() {
		return scalarType;
	}

	public StorageKind storageKind() {
		return scalarType.kind();
	}

	public ArraySettings settings() {
		return settings;
	}

	public State state() {
		return state;
	}

	@Override
	public @Nullable ArrayStream stream() {
		List<ArrayStream> streams = childrenOfType(ArrayStream.class);
		return streams.isEmpty()? null : streams.get(0);
	}

	/**
	 * @return the shape of the array, fastest-varying dimension first.
	 * Before the array has been allocated, this is computed from the {@link Dim} children.
	 */
	public int[] shape() {
		NumericArray a = array;
		return (a == null)? Shapes.resolveShape(dimensions()) : a.shape();
	}

	/**
	 * @throws IllegalStateException if no values have been read yet
	 */
	public NumericArray array() {
		NumericArray a = array;
		if (a == null) {
			throw new IllegalStateException("Array \"" + name() + "\" has no values yet");
		}
		return a;
	}

	NumericArray allocate() {
		if (state != State.EMPTY) {
			throw new IllegalStateException("Array \"" + name() + "\" is already " + state);
		}
		int[] shape = shape();
		LOGGER.debug("Allocating {} array \"{}\" with shape {}", scalarType, name(), Arrays.toString(shape));
		NumericArray a = NumericArray.zeros(scalarType, shape);
		array = a;
		state = State.ALLOCATED;
		return a;
	}

	void complete() {
		if (state != State.ALLOCATED) {
			throw new IllegalStateException("Array \"" + name() + "\" can't be completed when " + state);
		}
		state = State.COMPLETE;
		LOGGER.debug("Completed array \"{}\"", name());
	}

	@Override
	public void unlink() {
		super.unlink();
		array = null;
		state = State.EMPTY;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TypedArray.class);
}
