package com.consullo.editor.session;

import com.consullo.editor.core.Document;
import com.consullo.editor.core.EditorException;
import com.consullo.editor.core.InvalidOperationException;
import com.consullo.editor.core.OutOfBoundsException;
import com.consullo.editor.core.TextStorage;
import com.consullo.editor.core.events.DocumentChangeEvent;
import com.consullo.editor.core.events.DocumentChangeListener;
import com.consullo.editor.io.FileService;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multi-document manager: an ordered set of documents, one of which is current.
 *
 * <p>
 * Invariants:
 * <ul>
 * <li>{@code documents} and {@code metadata} are parallel lists of equal length; index {@code i}
 * of one describes index {@code i} of the other.</li>
 * <li>There is always at least one document. Closing the last one replaces it with a fresh
 * untitled document.</li>
 * <li>{@code 0 <= currentIndex < documents.size()}.</li>
 * </ul>
 * </p>
 *
 * <p>The {@link TextStorage} methods operate on the current document. Each successful mutation
 * marks that document dirty and publishes a {@link DocumentChangeEvent}. Not thread-safe; a
 * session is driven by a single editing loop.
 *
 * @since 1.0
 */
public final class Session implements TextStorage {

  private static final Logger LOGGER = LoggerFactory.getLogger(Session.class);

  static final String UNTITLED_PREFIX = "*untitled-";

  private final FileService fileService;

  private final List<Document> documents = new ArrayList<>();
  private final List<DocumentMetadata> metadata = new ArrayList<>();
  private final List<DocumentChangeListener> listeners = new ArrayList<>();

  private int currentIndex;
  private int nextUntitledId;

  /**
   * Index and metadata of one open document.
   *
   * @param index position in the session
   * @param metadata document metadata
   */
  public record Listing(int index, DocumentMetadata metadata) {
  }

  /**
   * Creates a session holding a single untitled document.
   *
   * @param fileService storage used to open and save documents
   */
  public Session(final FileService fileService) {
    Validate.notNull(fileService, "fileService must not be null");
    this.fileService = fileService;
    newEmpty();
  }

  private Session(final FileService fileService, final List<String> names) throws IOException {
    this.fileService = fileService;
    if (names.isEmpty()) {
      newEmpty();
      return;
    }
    for (final String name : names) {
      openOrFocus(name);
    }
  }

  /**
   * Creates a session with the given files open, in order, focused on the last one.
   *
   * @param fileService storage used to open and save documents
   * @param names names to open; an empty list yields one untitled document
   * @return new session
   * @throws IOException if any file cannot be opened
   */
  public static Session fromFiles(final FileService fileService, final List<String> names) throws IOException {
    Validate.notNull(fileService, "fileService must not be null");
    Validate.notNull(names, "names must not be null");

    return new Session(fileService, names);
  }

  /**
   * Focuses the document with the given name, opening it through the file service if it is not
   * open yet.
   *
   * @param name document name
   * @return index of the focused document
   * @throws IOException if the file service cannot open the document
   */
  public int openOrFocus(final String name) throws IOException {
    Validate.notNull(name, "name must not be null");

    final Optional<Integer> existing = findByName(name);
    if (existing.isPresent()) {
      this.currentIndex = existing.get();
      return this.currentIndex;
    }

    final String content = this.fileService.open(name);
    final int index = add(Document.fromContent(content), new DocumentMetadata(name));
    LOGGER.debug("Opened {} ({} chars) at index {}", name, content.length(), index);
    return index;
  }

  /**
   * Creates and focuses an empty document named {@code *untitled-N}. N increases with every call
   * and is never reused within this session.
   *
   * @return index of the new document
   */
  public int newEmpty() {
    return add(new Document(), new DocumentMetadata(nextUntitledName()));
  }

  /**
   * Focuses the document at the given index.
   *
   * @param index document index
   * @throws OutOfBoundsException if no document has that index
   */
  public void switchTo(final int index) throws OutOfBoundsException {
    checkIndex(index);
    this.currentIndex = index;
  }

  /**
   * Closes the document at the given index. Closing the only document replaces it in place with a
   * fresh untitled document.
   *
   * @param index document index
   * @throws OutOfBoundsException if no document has that index
   */
  public void close(final int index) throws OutOfBoundsException {
    checkIndex(index);
    LOGGER.debug("Closing {}", this.metadata.get(index).getName());

    if (this.documents.size() == 1) {
      this.documents.set(0, new Document());
      this.metadata.set(0, new DocumentMetadata(nextUntitledName()));
      this.currentIndex = 0;
      return;
    }

    this.documents.remove(index);
    this.metadata.remove(index);

    if (this.currentIndex >= index && this.currentIndex > 0) {
      this.currentIndex--;
    } else if (this.currentIndex >= this.documents.size()) {
      this.currentIndex = this.documents.size() - 1;
    }
  }

  public void closeCurrent() throws OutOfBoundsException {
    close(this.currentIndex);
  }

  /**
   * Focuses the next document, wrapping around after the last.
   *
   * @throws InvalidOperationException if the session holds no documents
   */
  public void next() throws InvalidOperationException {
    if (this.documents.isEmpty()) {
      throw new InvalidOperationException("No documents available");
    }
    this.currentIndex = (this.currentIndex + 1) % this.documents.size();
  }

  /**
   * Focuses the previous document, wrapping around before the first.
   *
   * @throws InvalidOperationException if the session holds no documents
   */
  public void previous() throws InvalidOperationException {
    if (this.documents.isEmpty()) {
      throw new InvalidOperationException("No documents available");
    }
    this.currentIndex = this.currentIndex == 0 ? this.documents.size() - 1 : this.currentIndex - 1;
  }

  /**
   * Writes the current document through the file service under its name. The dirty flag is
   * cleared only if the write succeeds.
   *
   * @throws IOException if the file service rejects the write
   */
  public void saveCurrent() throws IOException {
    final DocumentMetadata info = currentMetadata();
    this.fileService.save(info.getName(), currentDocument().content());
    info.markClean();
    LOGGER.info("Saved {}", info.getName());
  }

  /**
   * Renames the current document and saves it under the new name. The old name is kept if the
   * save fails.
   *
   * @param name new document name
   * @throws InvalidOperationException if another open document already has that name
   * @throws IOException if the file service rejects the write
   */
  public void saveCurrentAs(final String name) throws IOException, InvalidOperationException {
    Validate.notNull(name, "name must not be null");
    final Optional<Integer> existing = findByName(name);
    if (existing.isPresent() && existing.get() != this.currentIndex) {
      throw new InvalidOperationException("Document " + name + " is already open at index " + existing.get());
    }
    final DocumentMetadata info = currentMetadata();
    final String previousName = info.getName();
    info.setName(name);
    try {
      saveCurrent();
    } catch (final IOException e) {
      info.setName(previousName);
      throw e;
    }
  }

  /**
   * Replaces the whole content of the current document, for example with an undo snapshot.
   *
   * @param text new content
   */
  public void restoreCurrent(final String text) {
    Validate.notNull(text, "text must not be null");
    this.documents.set(this.currentIndex, Document.fromContent(text));
    markChanged(DocumentChangeEvent.Kind.RESTORE, -1);
  }

  public Optional<Integer> findByName(final String name) {
    for (int i = 0; i < this.metadata.size(); i++) {
      if (this.metadata.get(i).getName().equals(name)) {
        return Optional.of(i);
      }
    }
    return Optional.empty();
  }

  public List<Listing> listDocuments() {
    final List<Listing> out = new ArrayList<>(this.metadata.size());
    for (int i = 0; i < this.metadata.size(); i++) {
      out.add(new Listing(i, this.metadata.get(i)));
    }
    return Collections.unmodifiableList(out);
  }

  public int modifiedCount() {
    int count = 0;
    for (final DocumentMetadata info : this.metadata) {
      if (info.isDirty()) {
        count++;
      }
    }
    return count;
  }

  public Document currentDocument() {
    return this.documents.get(this.currentIndex);
  }

  public DocumentMetadata currentMetadata() {
    return this.metadata.get(this.currentIndex);
  }

  public Optional<DocumentMetadata> metadata(final int index) {
    if (index < 0 || index >= this.metadata.size()) {
      return Optional.empty();
    }
    return Optional.of(this.metadata.get(index));
  }

  public int currentIndex() {
    return this.currentIndex;
  }

  public int count() {
    return this.documents.size();
  }

  /**
   * Formats the status line for the current document: its name, {@code *} when dirty, and
   * {@code [i/n]} when more than one document is open.
   *
   * @return status text
   */
  public String statusLine() {
    final DocumentMetadata info = currentMetadata();
    final StringBuilder sb = new StringBuilder(info.getName());
    if (info.isDirty()) {
      sb.append('*');
    }
    if (this.documents.size() > 1) {
      sb.append(" [").append(this.currentIndex + 1).append('/').append(this.documents.size()).append(']');
    }
    return sb.toString();
  }

  public void addChangeListener(final DocumentChangeListener listener) {
    Validate.notNull(listener, "listener must not be null");
    this.listeners.add(listener);
  }

  public void removeChangeListener(final DocumentChangeListener listener) {
    this.listeners.remove(listener);
  }

  @Override
  public String content() {
    return currentDocument().content();
  }

  @Override
  public int length() {
    return currentDocument().length();
  }

  @Override
  public boolean isEmpty() {
    return currentDocument().isEmpty();
  }

  @Override
  public void insert(final int offset, final char ch) throws EditorException {
    currentDocument().insert(offset, ch);
    markChanged(DocumentChangeEvent.Kind.INSERT, offset);
  }

  @Override
  public void delete(final int offset) throws EditorException {
    currentDocument().delete(offset);
    markChanged(DocumentChangeEvent.Kind.DELETE, offset);
  }

  @Override
  public void append(final String text) {
    Validate.notNull(text, "text must not be null");
    if (text.isEmpty()) {
      return;
    }
    final int offset = currentDocument().length();
    currentDocument().append(text);
    markChanged(DocumentChangeEvent.Kind.APPEND, offset);
  }

  @Override
  public void clear() {
    currentDocument().clear();
    markChanged(DocumentChangeEvent.Kind.CLEAR, -1);
  }

  @Override
  public int lineCount() {
    return currentDocument().lineCount();
  }

  @Override
  public int lineLength(final int line) {
    return currentDocument().lineLength(line);
  }

  @Override
  public Optional<String> getLine(final int line) {
    return currentDocument().getLine(line);
  }

  private int add(final Document document, final DocumentMetadata info) {
    this.documents.add(document);
    this.metadata.add(info);
    this.currentIndex = this.documents.size() - 1;
    return this.currentIndex;
  }

  private String nextUntitledName() {
    return UNTITLED_PREFIX + this.nextUntitledId++;
  }

  private void checkIndex(final int index) throws OutOfBoundsException {
    if (index < 0 || index >= this.documents.size()) {
      throw new OutOfBoundsException("Document index " + index + " out of range for " + this.documents.size() + " documents");
    }
  }

  private void markChanged(final DocumentChangeEvent.Kind kind, final int offset) {
    final DocumentMetadata info = currentMetadata();
    info.markDirty();

    if (this.listeners.isEmpty()) {
      return;
    }
    final DocumentChangeEvent event = offset < 0
        ? DocumentChangeEvent.whole(this.currentIndex, info.getName(), kind)
        : DocumentChangeEvent.at(this.currentIndex, info.getName(), kind, offset);
    for (final DocumentChangeListener listener : new ArrayList<>(this.listeners)) {
      try {
        listener.onChange(event);
      } catch (final RuntimeException e) {
        LOGGER.warn("Change listener {} failed: {}", listener, e.getMessage(), e);
      }
    }
  }
}
