package edu.upf.taln.enhancedsearch.tools;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import edu.upf.taln.enhancedsearch.common.CMLCheckers;
import edu.upf.taln.enhancedsearch.common.ResourcesFactory;
import edu.upf.taln.enhancedsearch.common.SearchProperties;
import edu.upf.taln.enhancedsearch.common.SolrQueryGenerator;
import edu.upf.taln.enhancedsearch.core.query.SemanticQueryProcessor;
import edu.upf.taln.enhancedsearch.core.structures.Query;
import edu.upf.taln.enhancedsearch.core.structures.RelationshipType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;

public class Driver
{
	private static final String annotate_command = "annotate";
	private static final String resolve_command = "resolve";
	private static final String search_command = "search";
	private final static Logger log = LogManager.getLogger();

	private static abstract class BaseCommand
	{
		@Parameter(names = {"-p", "-properties"}, description = "Path to properties file. If missing, demo labels are used", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		protected Path properties;
		@Parameter(names = {"-q", "-query"}, description = "Query text", arity = 1, required = true,
				validateWith = CMLCheckers.NonBlankString.class)
		protected String query;
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Annotate a query and print its annotations and statements")
	private static class AnnotateCommand extends BaseCommand
	{
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Annotate a query and resolve its statements against the configured SPARQL endpoint")
	private static class ResolveCommand extends BaseCommand
	{
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Annotate a query and print it as a Solr document search")
	private static class SearchCommand extends BaseCommand
	{
		@Parameter(names = {"-f", "-field"}, description = "Solr search field", arity = 1,
				validateWith = CMLCheckers.NonBlankString.class)
		private String field = SolrQueryGenerator.DEFAULT_FIELD;
		@Parameter(names = {"-or"}, description = "Join unrelated query elements with OR instead of AND")
		private boolean or = false;
	}

	public static void main(String[] args) throws Exception
	{
		AnnotateCommand annotate = new AnnotateCommand();
		ResolveCommand resolve = new ResolveCommand();
		SearchCommand search = new SearchCommand();

		JCommander jc = new JCommander();
		jc.addCommand(annotate_command, annotate);
		jc.addCommand(resolve_command, resolve);
		jc.addCommand(search_command, search);
		jc.parse(args);

		if (jc.getParsedCommand() == null)
		{
			jc.usage();
			return;
		}

		DateFormat dateFormat = new SimpleDateFormat("dd/MM/yyyy HH:mm:ss");
		Date date = new Date();
		log.info(dateFormat.format(date) + " running \n\t" + String.join("\n\t", args));
		log.info("\n*********************************************************");

		switch (jc.getParsedCommand())
		{
			case annotate_command:
			{
				ResourcesFactory resources = new ResourcesFactory(load(annotate.properties));
				Query query = new Query(annotate.query);
				resources.createProcessor().updateQueryWithAnnotations(query);
				System.out.println(QueryPrinter.print(query));
				break;
			}
			case resolve_command:
			{
				ResourcesFactory resources = new ResourcesFactory(load(resolve.properties));
				if (resources.getEngine() == null)
					throw new IllegalArgumentException("No SPARQL endpoint configured, set es.sparql.endpoint");
				SemanticQueryProcessor processor = resources.createProcessor();
				Query query = new Query(resolve.query);
				processor.updateQueryWithAnnotations(query);
				final boolean resolved = processor.resolveQueryAnnotations(query);
				log.info(resolved ? "Query resolved" : "No identifiers bound");
				System.out.println(QueryPrinter.print(query));
				break;
			}
			case search_command:
			{
				ResourcesFactory resources = new ResourcesFactory(load(search.properties));
				Query query = new Query(search.query);
				resources.createProcessor().updateQueryWithAnnotations(query);
				SolrQueryGenerator generator = new SolrQueryGenerator(search.field,
						search.or ? RelationshipType.OR : RelationshipType.AND);
				System.out.println(generator.generate(query));
				break;
			}
			default:
				jc.usage();
		}
	}

	private static SearchProperties load(Path properties)
	{
		return properties != null ? new SearchProperties(properties) : new SearchProperties();
	}
}
