/*
   Copyright (c) 2015 LinkedIn Corp.

   Licensed under the Apache License, Version 2.0 (the "License");
   you may not use this file except in compliance with the License.
   You may obtain a copy of the License at

       http://www.apache.org/licenses/LICENSE-2.0

   Unless required by applicable law or agreed to in writing, software
   distributed under the License is distributed on an "AS IS" BASIS,
   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
   See the License for the specific language governing permissions and
   limitations under the License.
*/

package com.linkedin.formdata;


import com.linkedin.data.ByteString;
import com.linkedin.formdata.exceptions.BodyTooLargeException;
import com.linkedin.formdata.exceptions.DecodeException;
import com.linkedin.formdata.exceptions.MultiPartFormDataException;
import com.linkedin.formdata.exceptions.StateViolationException;
import com.linkedin.formdata.exceptions.UnexpectedEndOfStreamException;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Streaming multipart/form-data decoder based on RFC 7578 and the framing rules of RFC 2046.
 *
 * Callers push the body in chunks of any size using {@link #feed(ByteString)} or
 * {@link #feed(ByteString, DecodeEventHandler)} and call {@link #finish()} once the body is complete. The decoder
 * uses a small look-ahead buffer, so boundaries that straddle chunk edges are recognized and memory use does not
 * depend on the size of the body. Splitting a body differently never changes the parts it decodes to.
 *
 * Once the terminal boundary was read the decoder is done. Bytes following it in the same chunk are discarded as
 * epilogue and any later non-empty chunk is rejected, except for the CRLF that ends the terminal boundary line.
 *
 * Any error is sticky. Once a call threw, every later call to {@link #feed(ByteString)} or {@link #finish()} throws
 * the very same exception instance and no more bytes are examined.
 *
 * Note that NONE of the APIs in this class are thread safe. Calls on one decoder must be sequential.
 *
 * @author Karim Vidhani
 */
public final class MultiPartFormDataDecoder
{
  private static final Logger log = LoggerFactory.getLogger(MultiPartFormDataDecoder.class);

  public static final long DEFAULT_MAXIMUM_BODY_SIZE = -1;
  public static final int DEFAULT_MAXIMUM_HEADER_BLOCK_SIZE = 16 * 1024;
  public static final Charset DEFAULT_HEADER_CHARSET = MultiPartFormDataUtils.UTF_8;

  private final PartStateMachine _stateMachine;
  private final long _maximumBodySize;
  private long _bytesConsumed = 0;
  private boolean _finished = false;
  private MultiPartFormDataException _failure;

  /**
   * Creates a decoder with default limits.
   *
   * @param boundary the boundary parameter of the request's Content-Type header, without quotes.
   * @throws DecodeException if the boundary is empty or longer than 70 characters.
   */
  public MultiPartFormDataDecoder(final String boundary)
  {
    this(toBoundaryBytes(boundary));
  }

  public MultiPartFormDataDecoder(final byte[] boundary)
  {
    this(boundary, DEFAULT_MAXIMUM_BODY_SIZE, DEFAULT_MAXIMUM_HEADER_BLOCK_SIZE,
        new PartHeaderParser(DEFAULT_HEADER_CHARSET));
  }

  //Package private to allow a different header parser for testing.
  MultiPartFormDataDecoder(final byte[] boundary, final long maximumBodySize, final int maximumHeaderBlockSize,
      final PartHeaderParser headerParser)
  {
    final BoundaryScanner scanner = new BoundaryScanner(MultiPartFormDataUtils.validateBoundary(boundary));
    if (maximumHeaderBlockSize <= 0)
    {
      throw new IllegalArgumentException("The maximum header block size must be positive");
    }
    _stateMachine = new PartStateMachine(scanner, headerParser, maximumHeaderBlockSize);
    _maximumBodySize = maximumBodySize;
  }

  private static byte[] toBoundaryBytes(final String boundary)
  {
    if (boundary == null)
    {
      throw new IllegalArgumentException("Null boundary provided");
    }
    return boundary.getBytes(MultiPartFormDataUtils.ASCII);
  }

  /**
   * Feeds the next chunk of the body and returns the events it completed, in order.
   *
   * @param chunk the next bytes of the body. An empty chunk is a no-op.
   * @return the events produced by this chunk. May be empty.
   * @throws MultiPartFormDataException if the body is malformed, a limit was exceeded, the decoder failed earlier,
   *                                    or the terminal boundary was already read.
   */
  public List<DecodeEvent> feed(final ByteString chunk)
  {
    final EventCollector collector = new EventCollector();
    feed(chunk, collector);
    return collector.getEvents();
  }

  public List<DecodeEvent> feed(final byte[] chunk)
  {
    if (chunk == null)
    {
      throw new IllegalArgumentException("Null chunk provided");
    }
    return feed(ByteString.copy(chunk));
  }

  /**
   * Feeds the next chunk of the body, delivering the events it completes to the handler as they are found.
   *
   * If the handler throws, the decoder fails. A {@link MultiPartFormDataException} from the handler is rethrown as
   * is, any other exception is wrapped in a {@link DecodeException}.
   */
  public void feed(final ByteString chunk, final DecodeEventHandler handler)
  {
    if (_failure != null)
    {
      throw _failure;
    }
    if (chunk == null || handler == null)
    {
      throw new IllegalArgumentException("Chunk and handler are required");
    }
    if (_finished)
    {
      throw new StateViolationException("Cannot feed data after finish() was called");
    }
    if (chunk.isEmpty())
    {
      return;
    }
    if (_stateMachine.getState() == DecoderState.DONE && !_stateMachine.completesTerminalLine(chunk))
    {
      throw new StateViolationException("Cannot feed data after the terminal boundary was read");
    }

    if (_maximumBodySize >= 0 && _bytesConsumed + chunk.length() > _maximumBodySize)
    {
      throw fail(new BodyTooLargeException("The multipart/form-data body exceeds the maximum size of "
          + _maximumBodySize + " bytes."));
    }
    _bytesConsumed += chunk.length();

    try
    {
      _stateMachine.process(chunk, handler);
    }
    catch (MultiPartFormDataException exception)
    {
      throw fail(exception);
    }
    catch (RuntimeException exception)
    {
      throw fail(new DecodeException("Exception while handling decoded multipart/form-data events", exception));
    }
  }

  /**
   * Signals that the body is complete.
   *
   * @throws UnexpectedEndOfStreamException if the terminal boundary was never seen.
   * @throws MultiPartFormDataException if the decoder failed earlier.
   */
  public void finish()
  {
    if (_failure != null)
    {
      throw _failure;
    }
    if (_stateMachine.getState() != DecoderState.DONE)
    {
      throw fail(new UnexpectedEndOfStreamException("Malformed multipart/form-data request. The body ended in state "
          + _stateMachine.getState() + " before the terminal boundary."));
    }
    if (!_finished)
    {
      _finished = true;
      log.debug("Finished decoding {} parts from {} bytes", _stateMachine.getPartCount(), _bytesConsumed);
    }
  }

  public DecoderState getState()
  {
    return _stateMachine.getState();
  }

  /**
   * Number of parts whose headers were read so far.
   */
  public int getPartCount()
  {
    return _stateMachine.getPartCount();
  }

  /**
   * Total number of bytes accepted by {@link #feed(ByteString)}, including preamble and epilogue.
   */
  public long getBytesConsumed()
  {
    return _bytesConsumed;
  }

  private MultiPartFormDataException fail(final MultiPartFormDataException exception)
  {
    //All exceptions caught here put the decoder in a non-usable state. Continuing from this point forward is not
    //feasible.
    log.warn("Decoding multipart/form-data failed after {} bytes: {}", _bytesConsumed, exception.getMessage());
    _stateMachine.fail();
    _failure = exception;
    return exception;
  }

  /**
   * Builder for decoders with non-default limits.
   */
  public static final class Builder
  {
    private final byte[] _boundary;
    private long _maximumBodySize = DEFAULT_MAXIMUM_BODY_SIZE;
    private int _maximumHeaderBlockSize = DEFAULT_MAXIMUM_HEADER_BLOCK_SIZE;
    private Charset _headerCharset = DEFAULT_HEADER_CHARSET;

    public Builder(final String boundary)
    {
      this(toBoundaryBytes(boundary));
    }

    public Builder(final byte[] boundary)
    {
      _boundary = boundary;
    }

    /**
     * Limits the total number of bytes the decoder accepts. A negative value, the default, means no limit.
     */
    public Builder withMaximumBodySize(final long maximumBodySize)
    {
      _maximumBodySize = maximumBodySize;
      return this;
    }

    public Builder withMaximumHeaderBlockSize(final int maximumHeaderBlockSize)
    {
      _maximumHeaderBlockSize = maximumHeaderBlockSize;
      return this;
    }

    public Builder withHeaderCharset(final Charset headerCharset)
    {
      _headerCharset = headerCharset;
      return this;
    }

    public MultiPartFormDataDecoder build()
    {
      return new MultiPartFormDataDecoder(_boundary, _maximumBodySize, _maximumHeaderBlockSize,
          new PartHeaderParser(_headerCharset));
    }
  }

  private static final class EventCollector implements DecodeEventHandler
  {
    private final List<DecodeEvent> _events = new ArrayList<DecodeEvent>();

    @Override
    public void onPartStarted(final DecodeEvent.PartStarted partStarted)
    {
      _events.add(partStarted);
    }

    @Override
    public void onBodyChunk(final DecodeEvent.BodyChunk bodyChunk)
    {
      _events.add(bodyChunk);
    }

    @Override
    public void onPartEnded(final DecodeEvent.PartEnded partEnded)
    {
      _events.add(partEnded);
    }

    private List<DecodeEvent> getEvents()
    {
      return Collections.unmodifiableList(_events);
    }
  }
}
