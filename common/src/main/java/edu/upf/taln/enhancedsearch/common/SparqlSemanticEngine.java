package edu.upf.taln.enhancedsearch.common;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import edu.upf.taln.enhancedsearch.core.query.SemanticEngine;
import edu.upf.taln.enhancedsearch.core.structures.Statement;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.query.BindingSet;
import org.eclipse.rdf4j.query.QueryLanguage;
import org.eclipse.rdf4j.query.TupleQuery;
import org.eclipse.rdf4j.query.TupleQueryResult;
import org.eclipse.rdf4j.repository.Repository;
import org.eclipse.rdf4j.repository.RepositoryConnection;
import org.eclipse.rdf4j.repository.sparql.SPARQLRepository;

import java.util.List;

/**
 * Resolves statements by running the generated SPARQL queries against an RDF4J repository, either a remote SPARQL
 * endpoint or any local repository.
 */
public class SparqlSemanticEngine implements SemanticEngine
{
	private final Repository repository;
	private final SparqlQueryGenerator generator;
	private final String variable;
	private final static Logger log = LogManager.getLogger();

	public SparqlSemanticEngine(Repository repository, SparqlQueryGenerator generator, String variable)
	{
		this.repository = repository;
		this.generator = generator;
		this.variable = variable.startsWith("?") ? variable.substring(1) : variable;
	}

	public static SparqlSemanticEngine connect(String endpoint, SparqlQueryGenerator generator, String variable)
	{
		log.info("Setting up connection to SPARQL endpoint " + endpoint);
		Stopwatch timer = Stopwatch.createStarted();
		SPARQLRepository repository = new SPARQLRepository(endpoint);
		repository.init();
		log.info("SPARQL endpoint set up in " + timer.stop());
		return new SparqlSemanticEngine(repository, generator, variable);
	}

	@Override
	public ListMultimap<Integer, String> execute(List<Statement> statements)
	{
		ListMultimap<Integer, String> bindings = ArrayListMultimap.create();
		if (statements.isEmpty())
			return bindings;

		final String query = generator.generate("?" + variable, statements);
		log.debug("SPARQL query:\n" + query);

		Stopwatch timer = Stopwatch.createStarted();
		try (RepositoryConnection connection = repository.getConnection())
		{
			final TupleQuery tuple_query = connection.prepareTupleQuery(QueryLanguage.SPARQL, query);
			try (TupleQueryResult response = tuple_query.evaluate())
			{
				for (BindingSet bs : response)
				{
					final Value value = bs.getValue(variable);
					if (value != null && !bindings.containsEntry(SUBJECT_POSITION, value.stringValue()))
						bindings.put(SUBJECT_POSITION, value.stringValue());
				}
			}
		}
		catch (RuntimeException e)
		{
			log.error("The following query FAILED: " + query);
			throw e;
		}

		log.debug("SPARQL query bound " + bindings.size() + " values in " + timer.stop());
		return bindings;
	}
}
