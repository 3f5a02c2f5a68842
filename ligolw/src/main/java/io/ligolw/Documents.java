package io.ligolw;

import io.ligolw.exceptions.LigoLwException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.function.Function;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Loads and writes whole documents.
 */
public final class Documents {
	private Documents() { }

	public static Document load(InputStream in) throws IOException {
		return load(in, ContentHandler::new);
	}

	/**
	 * @param handlerFactory creates the {@link ContentHandler} that will populate the given document;
	 *                       pass a subclass's constructor to get more capable elements
	 * @throws LigoLwException if the document's content is invalid
	 * @throws IOException if the input can't be read or is not well-formed XML
	 */
	public static Document load(InputStream in, Function<? super Document, ? extends ContentHandler> handlerFactory) throws IOException {
		Document document = new Document();
		ContentHandler handler = handlerFactory.apply(document);
		try {
			newParser().parse(new InputSource(in), handler);
		} catch (SAXException e) {
			if (e.getException() instanceof LigoLwException l) {
				throw l;
			}
			throw new IOException("Unable to parse document", e);
		}
		LOGGER.debug("Loaded document with {} top-level elements", document.children().size());
		return document;
	}

	public static Document loadString(String xml, Function<? super Document, ? extends ContentHandler> handlerFactory) {
		try {
			return load(new ByteArrayInputStream(xml.getBytes(UTF_8)), handlerFactory);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	public static void write(Document document, Writer out) throws IOException {
		document.write(out);
		out.flush();
	}

	public static String toXml(Document document) {
		StringWriter out = new StringWriter();
		try {
			write(document, out);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		return out.toString();
	}

	private static SAXParser newParser() throws IOException {
		try {
			SAXParserFactory factory = SAXParserFactory.newInstance();
			factory.setNamespaceAware(false);
			factory.setValidating(false);
			return factory.newSAXParser();
		} catch (ParserConfigurationException | SAXException e) {
			throw new IOException("Unable to create XML parser", e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Documents.class);
}
