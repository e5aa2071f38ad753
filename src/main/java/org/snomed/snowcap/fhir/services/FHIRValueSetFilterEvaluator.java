package org.snomed.snowcap.fhir.services;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Iterators;
import org.apache.commons.lang3.StringUtils;
import org.hl7.fhir.r4.model.ValueSet;
import org.snomed.snowcap.fhir.domain.FHIRConcept;
import org.snomed.snowcap.fhir.domain.FHIRProperty;
import org.snomed.snowcap.fhir.domain.FHIRPropertyType;
import org.snomed.snowcap.fhir.domain.FHIRValueSetFilter;
import org.snomed.snowcap.fhir.exceptions.InvalidFilterException;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static org.snomed.snowcap.fhir.config.FHIRConstants.*;

/**
 * Evaluates a single value set filter against a concept index.
 * <p>
 * The filter is checked and its value parsed when {@link #evaluate} is called, so a bad filter fails before any code is produced.
 * The result is lazy and can be iterated any number of times, each iteration producing the same codes in the same order.
 */
@Service
public class FHIRValueSetFilterEvaluator {

	private static final Set<String> IMPLICIT_PROPERTIES = Set.of(CONCEPT, CODE, DISPLAY, INACTIVE, STATUS, PARENT, CHILD, DEFINITION);

	public Iterable<String> evaluate(FHIRValueSetFilter filter, FHIRConceptIndex index) {
		return evaluate(filter, index, false);
	}

	/**
	 * @param memoize when true the codes are computed once, on first iteration, and kept by the returned iterable
	 * @throws InvalidFilterException if the operator or property is unknown, or the value is not valid for them
	 */
	public Iterable<String> evaluate(FHIRValueSetFilter filter, FHIRConceptIndex index, boolean memoize) {
		Iterable<String> codes = compile(filter, index);
		if (memoize) {
			Supplier<List<String>> memoized = Suppliers.memoize(() -> ImmutableList.copyOf(codes));
			return () -> memoized.get().iterator();
		}
		return codes;
	}

	private Iterable<String> compile(FHIRValueSetFilter filter, FHIRConceptIndex index) {
		ValueSet.FilterOperator operator = filter.getOperator();
		if (operator == null) {
			throw new InvalidFilterException(filter, index.getSystem(), format("Filter operator '%s' is not supported.", filter.getOp()));
		}
		String property = filter.getProperty();
		if (StringUtils.isEmpty(property)) {
			throw new InvalidFilterException(filter, index.getSystem(), "Filter property is missing.");
		}
		String value = filter.getValue();
		if (value == null && operator != ValueSet.FilterOperator.EXISTS) {
			throw new InvalidFilterException(filter, index.getSystem(), "Filter value is missing.");
		}

		switch (operator) {
			case ISA:
				requireHierarchyProperty(filter, index);
				return () -> index.contains(value) ? Iterators.concat(Iterators.singletonIterator(value), index.descendantsOf(value).iterator()) :
						Collections.emptyIterator();
			case DESCENDENTOF:
				requireHierarchyProperty(filter, index);
				return () -> index.descendantsOf(value).iterator();
			case GENERALIZES:
				requireHierarchyProperty(filter, index);
				return () -> index.contains(value) ? Iterators.concat(Iterators.singletonIterator(value), index.ancestorsOf(value).iterator()) :
						Collections.emptyIterator();
			case ISNOTA:
				requireHierarchyProperty(filter, index);
				return matching(index, concept -> !index.isA(concept.getCode(), value));
			case EXISTS:
				return matching(index, existsPredicate(filter, index));
			case EQUAL:
				return matching(index, inPredicate(filter, index, Collections.singletonList(value)));
			case IN:
				return matching(index, inPredicate(filter, index, splitValues(value)));
			case NOTIN:
				return matching(index, inPredicate(filter, index, splitValues(value)).negate());
			case REGEX:
				return matching(index, regexPredicate(filter, index));
			default:
				throw new InvalidFilterException(filter, index.getSystem(), format("Filter operator '%s' is not supported.", filter.getOp()));
		}
	}

	private static Iterable<String> matching(FHIRConceptIndex index, Predicate<FHIRConcept> predicate) {
		return () -> index.getConcepts().stream().filter(predicate).map(FHIRConcept::getCode).iterator();
	}

	private void requireHierarchyProperty(FHIRValueSetFilter filter, FHIRConceptIndex index) {
		if (!CONCEPT.equals(filter.getProperty()) && !CODE.equals(filter.getProperty())) {
			throw new InvalidFilterException(filter, index.getSystem(),
					format("Operator '%s' can only be used with the 'concept' or 'code' property.", filter.getOp()));
		}
	}

	private Predicate<FHIRConcept> existsPredicate(FHIRValueSetFilter filter, FHIRConceptIndex index) {
		String value = filter.getValue();
		boolean shouldExist;
		if (value == null || "true".equals(value)) {
			shouldExist = true;
		} else if ("false".equals(value)) {
			shouldExist = false;
		} else {
			throw new InvalidFilterException(filter, index.getSystem(), "The value of an 'exists' filter must be 'true' or 'false'.");
		}
		PropertyReader reader = propertyReader(filter, index);
		return concept -> !reader.read(concept).isEmpty() == shouldExist;
	}

	private Predicate<FHIRConcept> inPredicate(FHIRValueSetFilter filter, FHIRConceptIndex index, List<String> values) {
		PropertyReader reader = propertyReader(filter, index);
		FHIRPropertyType type = propertyType(filter.getProperty(), index);
		Set<Object> typedValues = new HashSet<>();
		for (String value : values) {
			try {
				typedValues.add(type.parse(value));
			} catch (IllegalArgumentException e) {
				throw new InvalidFilterException(filter, index.getSystem(),
						format("Value '%s' is not valid for property '%s' of type %s.", value, filter.getProperty(), type), e);
			}
		}
		return concept -> {
			for (FHIRProperty property : reader.read(concept)) {
				if (typedValues.contains(property.getTypedValue())) {
					return true;
				}
			}
			return false;
		};
	}

	private Predicate<FHIRConcept> regexPredicate(FHIRValueSetFilter filter, FHIRConceptIndex index) {
		PropertyReader reader = propertyReader(filter, index);
		Pattern pattern;
		try {
			pattern = Pattern.compile(filter.getValue());
		} catch (PatternSyntaxException e) {
			throw new InvalidFilterException(filter, index.getSystem(), "Malformed regular expression: " + e.getDescription(), e);
		}
		return concept -> {
			for (FHIRProperty property : reader.read(concept)) {
				if (property.getValue() != null && pattern.matcher(property.getValue()).matches()) {
					return true;
				}
			}
			return false;
		};
	}

	private static List<String> splitValues(String value) {
		return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).collect(Collectors.toList());
	}

	private static FHIRPropertyType propertyType(String property, FHIRConceptIndex index) {
		if (INACTIVE.equals(property)) {
			return FHIRPropertyType.BOOLEAN;
		}
		if (IMPLICIT_PROPERTIES.contains(property) && !index.getPropertyCodes().contains(property)) {
			return FHIRPropertyType.STRING;
		}
		FHIRPropertyType type = index.getPropertyType(property);
		return type != null ? type : FHIRPropertyType.STRING;
	}

	private PropertyReader propertyReader(FHIRValueSetFilter filter, FHIRConceptIndex index) {
		String property = filter.getProperty();
		boolean explicit = index.getCodeSystemVersion().getPropertyTypes().containsKey(property) || index.getPropertyCodes().contains(property);
		if (!explicit && !IMPLICIT_PROPERTIES.contains(property)) {
			throw new InvalidFilterException(filter, index.getSystem(), format("Property '%s' is not known in this code system.", property));
		}
		switch (property) {
			case CONCEPT:
			case CODE:
				return concept -> List.of(stringProperty(property, concept.getCode()));
			case DISPLAY:
				return concept -> concept.getDisplay() != null ? List.of(stringProperty(property, concept.getDisplay())) : List.of();
			case DEFINITION:
				return concept -> concept.getDefinition() != null ? List.of(stringProperty(property, concept.getDefinition())) : List.of();
			case PARENT:
				return concept -> index.getParents(concept.getCode()).stream().map(code -> stringProperty(property, code)).collect(Collectors.toList());
			case CHILD:
				return concept -> index.getChildren(concept.getCode()).stream().map(code -> stringProperty(property, code)).collect(Collectors.toList());
			case INACTIVE:
				return concept -> List.of(new FHIRProperty(INACTIVE, null, Boolean.toString(!concept.isActive()), FHIRPropertyType.BOOLEAN));
			case STATUS:
				return concept -> {
					List<FHIRProperty> status = concept.getProperty(STATUS);
					return !status.isEmpty() ? status : List.of(new FHIRProperty(STATUS, null, concept.isActive() ? ACTIVE : RETIRED, FHIRPropertyType.CODE));
				};
			default:
				return concept -> concept.getProperty(property);
		}
	}

	private static FHIRProperty stringProperty(String code, String value) {
		return new FHIRProperty(code, null, value, FHIRPropertyType.STRING);
	}

	private interface PropertyReader {
		List<FHIRProperty> read(FHIRConcept concept);
	}

	/**
	 * Codes matching all the filters. Each filter is checked before any is evaluated.
	 */
	public Set<String> evaluateAll(List<FHIRValueSetFilter> filters, FHIRConceptIndex index) {
		List<Iterable<String>> results = new ArrayList<>();
		for (FHIRValueSetFilter filter : filters) {
			results.add(evaluate(filter, index));
		}
		Set<String> codes = null;
		for (Iterable<String> result : results) {
			if (codes == null) {
				codes = new LinkedHashSet<>();
				Iterables.addAll(codes, result);
			} else {
				Set<String> next = new HashSet<>();
				Iterables.addAll(next, result);
				codes.retainAll(next);
			}
		}
		return codes != null ? codes : new LinkedHashSet<>();
	}
}
