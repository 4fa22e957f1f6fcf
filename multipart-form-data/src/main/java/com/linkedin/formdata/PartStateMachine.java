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
import com.linkedin.formdata.exceptions.HeaderBlockTooLargeException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Drives the look-ahead buffer through the phases of a multipart/form-data body and turns what it finds into
 * {@link DecodeEvent}s.
 *
 * Every call to {@link #process(ByteString, DecodeEventHandler)} appends the chunk to the buffer and then makes as
 * much progress as the buffered bytes allow. Whatever cannot be resolved yet stays in the buffer for the next call:
 * <ul>
 *   <li>While looking for the first boundary, only a suffix that may begin the boundary is kept. The preamble is
 *   dropped.</li>
 *   <li>While reading headers, the buffer holds the incomplete header block, up to the configured limit.</li>
 *   <li>While reading a body, only a suffix that may begin a delimiter is kept. Everything before it is handed out as
 *   a body chunk right away.</li>
 * </ul>
 *
 * @author Karim Vidhani
 */
final class PartStateMachine
{
  private static final Logger log = LoggerFactory.getLogger(PartStateMachine.class);

  private final BoundaryScanner _scanner;
  private final PartHeaderParser _headerParser;
  private final int _maximumHeaderBlockSize;
  private final ByteStringBuffer _buffer = new ByteStringBuffer();

  private DecoderState _state = DecoderState.PRE_BOUNDARY;
  //Once a preamble byte was dropped the buffer no longer starts at the beginning of the body, so the opening
  //delimiter without a leading CRLF can no longer occur.
  private boolean _preambleDiscarded = false;
  //Where to resume looking for the end of the header block. Saves rescanning the same bytes on every chunk.
  private int _headerSearchStart = 0;
  private int _partCount = 0;
  //How much of the line break that closes the terminal boundary line was read. Only the rest of that line break may
  //still arrive once done.
  private int _terminalLineEndIndex = 0;

  PartStateMachine(final BoundaryScanner scanner, final PartHeaderParser headerParser, final int maximumHeaderBlockSize)
  {
    _scanner = scanner;
    _headerParser = headerParser;
    _maximumHeaderBlockSize = maximumHeaderBlockSize;
  }

  DecoderState getState()
  {
    return _state;
  }

  int getPartCount()
  {
    return _partCount;
  }

  int getBufferedByteCount()
  {
    return _buffer.size();
  }

  void fail()
  {
    _state = DecoderState.FAILED;
    _buffer.clear();
  }

  void process(final ByteString chunk, final DecodeEventHandler handler)
  {
    if (_state == DecoderState.DONE && completesTerminalLine(chunk))
    {
      _terminalLineEndIndex += chunk.length();
      return;
    }
    if (_state == DecoderState.FAILED || _state == DecoderState.DONE)
    {
      throw new IllegalStateException("Cannot process data in state " + _state);
    }

    _buffer.add(chunk);

    boolean progress = true;
    while (progress)
    {
      switch (_state)
      {
        case PRE_BOUNDARY:
          progress = processPreamble();
          break;
        case IN_HEADERS:
          progress = processHeaders(handler);
          break;
        case IN_BODY:
          progress = processBody(handler);
          break;
        case DONE:
        {
          //Anything left after the terminal boundary is epilogue.
          final byte[] lineEnd = MultiPartFormDataUtils.CRLF_BYTES;
          _terminalLineEndIndex = _buffer.isPrefixOf(lineEnd) ? _buffer.size() : lineEnd.length;
          _buffer.clear();
          progress = false;
          break;
        }
        default:
          progress = false;
      }
    }
  }

  /**
   * True if the chunk holds nothing but the rest of the CRLF that ends the terminal boundary line. A body ending in
   * "--boundary--" may have that CRLF split off into a chunk of its own.
   */
  boolean completesTerminalLine(final ByteString chunk)
  {
    final byte[] lineEnd = MultiPartFormDataUtils.CRLF_BYTES;
    if (_state != DecoderState.DONE || chunk.length() > lineEnd.length - _terminalLineEndIndex)
    {
      return false;
    }
    final byte[] bytes = chunk.copyBytes();
    for (int i = 0; i < bytes.length; i++)
    {
      if (bytes[i] != lineEnd[_terminalLineEndIndex + i])
      {
        return false;
      }
    }
    return true;
  }

  private boolean processPreamble()
  {
    final BoundaryScanner.ScanResult result = _scanner.find(_buffer, 0, !_preambleDiscarded);
    switch (result.getKind())
    {
      case FOUND:
        _buffer.trimFromBeginning(result.getEnd());
        if (result.isFinal())
        {
          //The envelope looked like --someBoundary-- meaning there were no parts at all.
          transition(DecoderState.DONE);
        }
        else
        {
          transition(DecoderState.IN_HEADERS);
        }
        return true;
      case INCOMPLETE:
        discardPreamble(result.getStart());
        return false;
      default:
        discardPreamble(_buffer.size() - result.getRetain());
        return false;
    }
  }

  private void discardPreamble(final int count)
  {
    if (count > 0)
    {
      _buffer.trimFromBeginning(count);
      _preambleDiscarded = true;
    }
  }

  private boolean processHeaders(final DecodeEventHandler handler)
  {
    //Headers may or may not exist. If they do not exist we will see a blank line right after the boundary line.
    //Otherwise we will see the headers followed by two consecutive CRLFs.
    if (_buffer.size() < MultiPartFormDataUtils.CRLF_BYTES.length)
    {
      return false;
    }

    final byte[] headerBlock;
    if (_buffer.startsWith(MultiPartFormDataUtils.CRLF_BYTES))
    {
      headerBlock = new byte[0];
      _buffer.trimFromBeginning(MultiPartFormDataUtils.CRLF_BYTES.length);
    }
    else
    {
      final int headerEnding = _buffer.indexOfBytes(MultiPartFormDataUtils.CONSECUTIVE_CRLFS_BYTES, _headerSearchStart);
      if (headerEnding == -1)
      {
        //The blank line may still arrive right after the largest allowed block.
        if (_buffer.size() >= _maximumHeaderBlockSize + MultiPartFormDataUtils.CONSECUTIVE_CRLFS_BYTES.length)
        {
          throw new HeaderBlockTooLargeException("Malformed multipart/form-data request. The header block of part "
              + (_partCount + 1) + " exceeds " + _maximumHeaderBlockSize + " bytes.");
        }
        //The consecutive CRLFs may straddle the end of the buffer.
        _headerSearchStart = Math.max(0, _buffer.size() - (MultiPartFormDataUtils.CONSECUTIVE_CRLFS_BYTES.length - 1));
        return false;
      }
      if (headerEnding > _maximumHeaderBlockSize)
      {
        throw new HeaderBlockTooLargeException("Malformed multipart/form-data request. The header block of part "
            + (_partCount + 1) + " exceeds " + _maximumHeaderBlockSize + " bytes.");
      }
      headerBlock = _buffer.toByteArray(0, headerEnding);
      _buffer.trimFromBeginning(headerEnding + MultiPartFormDataUtils.CONSECUTIVE_CRLFS_BYTES.length);
    }
    _headerSearchStart = 0;

    final PartHeaders headers = _headerParser.parse(headerBlock);
    final ParameterizedHeader disposition = _headerParser.parseContentDisposition(headers);
    final DecodeEvent.PartStarted partStarted =
        new DecodeEvent.PartStarted(headers, disposition.getParameter(MultiPartFormDataUtils.NAME_PARAMETER),
            disposition.getParameter(MultiPartFormDataUtils.FILENAME_PARAMETER));

    _partCount++;
    transition(DecoderState.IN_BODY);
    if (log.isDebugEnabled())
    {
      log.debug("Part {} started: {}", _partCount, partStarted);
    }
    handler.onPartStarted(partStarted);
    return true;
  }

  private boolean processBody(final DecodeEventHandler handler)
  {
    final BoundaryScanner.ScanResult result = _scanner.find(_buffer, 0, false);
    switch (result.getKind())
    {
      case FOUND:
      {
        //The boundary is in the buffer. Everything before it are the last bytes of this part.
        final ByteString lastBytes = _buffer.copy(0, result.getStart());
        _buffer.trimFromBeginning(result.getEnd());
        transition(result.isFinal() ? DecoderState.DONE : DecoderState.IN_HEADERS);
        if (!lastBytes.isEmpty())
        {
          handler.onBodyChunk(new DecodeEvent.BodyChunk(lastBytes));
        }
        log.debug("Part {} ended", _partCount);
        handler.onPartEnded(DecodeEvent.PartEnded.INSTANCE);
        return true;
      }
      case INCOMPLETE:
        //A delimiter may start here. Hand out what comes before it and wait for more data.
        drainBody(result.getStart(), handler);
        return false;
      default:
        //We can't fully drain the buffer because the end of the buffer may include the partial beginning of
        //the next delimiter.
        drainBody(_buffer.size() - result.getRetain(), handler);
        return false;
    }
  }

  private void drainBody(final int count, final DecodeEventHandler handler)
  {
    if (count > 0)
    {
      final ByteString data = _buffer.copy(0, count);
      _buffer.trimFromBeginning(count);
      handler.onBodyChunk(new DecodeEvent.BodyChunk(data));
    }
  }

  private void transition(final DecoderState newState)
  {
    if (log.isDebugEnabled())
    {
      log.debug("Decoder state {} -> {}", _state, newState);
    }
    _state = newState;
  }
}
