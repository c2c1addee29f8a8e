package edu.upf.taln.enhancedsearch.core.engines;

import edu.upf.taln.enhancedsearch.core.Options;
import edu.upf.taln.enhancedsearch.core.structures.*;

import java.util.*;

import static java.util.stream.Collectors.toList;

/**
 * Turns label store matches into annotations, one per span and type, in priority order.
 * An annotation is safe only if its label has a single type and that type a single identifier.
 */
public class UriLinkingEngine implements AnnotationEngine
{
	private final Options options;

	/**
	 * Works on a copy of the options.
	 * @throws IllegalArgumentException if the options are not valid
	 */
	public UriLinkingEngine(Options options)
	{
		this.options = new Options(options);
		this.options.validate();
	}

	@Override
	public Set<Class<? extends AnnotationEngine>> getPrerequisites()
	{
		return Set.of(EntityLookupEngine.class);
	}

	@Override
	public AnnotationResult apply(AnnotationResult result)
	{
		List<Annotation> annotations = new ArrayList<>();
		for (LabelMatch match : result.getLookups())
		{
			final LabelEntry entry = match.getEntry();
			final boolean single_type = entry.getTypes().size() == 1;
			final Set<String> labels = Set.of(match.getText().toLowerCase(Locale.ROOT));

			entry.getTypes().stream()
					.sorted(Comparator.comparingInt(options.annotation_priority::indexOf))
					.forEach(type ->
					{
						final boolean safe = single_type && entry.getUris(type).size() == 1;
						final List<Uri> uris = entry.getUris(type).stream()
								.map(p -> new Uri(p.getLeft(), p.getRight(), safe, labels))
								.collect(toList());
						annotations.add(new Annotation(match.getBegin(), match.getEnd(), match.getText(),
								match.getLemma(), type, uris, safe));
					});
		}

		return result.withAnnotations(annotations);
	}
}
