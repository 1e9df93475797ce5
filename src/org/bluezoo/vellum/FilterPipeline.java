/*
 * FilterPipeline.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of Vellum, a PDF object model and incremental update
 * library.
 *
 * Vellum is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Vellum is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with Vellum.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.vellum;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds and manages a filter pipeline for decoding stream content.
 * <p>
 * The pipeline consists of zero or more filters followed by a final consumer.
 * Data is pushed through the pipeline in a feedforward manner:
 * <pre>
 *   Input → Filter1 → Filter2 → ... → Consumer
 * </pre>
 * <p>
 * Implements {@link WritableByteChannel} for standard NIO semantics.
 * <p>
 * Usage:
 * <pre>
 *   FilterPipeline pipeline = FilterPipeline.create(filter, decodeParms, finalConsumer);
 *   pipeline.write(data);
 *   pipeline.close();
 * </pre>
 * Most callers use the functional form {@link #decode(byte[], PDFObject, PDFObject)}.
 * <p>
 * Image codec filters (DCTDecode, JPXDecode, CCITTFaxDecode, JBIG2Decode)
 * and Crypt end the chain: their input is delivered to the consumer still
 * encoded, as are the outputs of any filters named after them.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FilterPipeline implements WritableByteChannel {

    private static final Logger LOGGER = Logger.getLogger(FilterPipeline.class.getName());

    private final WritableByteChannel head;
    private final List<StreamFilter> filters;
    private boolean open = true;

    private FilterPipeline(WritableByteChannel head, List<StreamFilter> filters) {
        this.head = head;
        this.filters = filters;
    }

    /**
     * Creates a filter pipeline from a stream's /Filter and /DecodeParms.
     *
     * @param filterObj the /Filter value: null, a name or an array of names
     * @param paramsObj the /DecodeParms value: null, a dictionary or an array
     * @param finalConsumer the consumer to receive decoded data
     * @return a new pipeline
     * @throws PDFParseException if a filter is not supported or the values
     *         are malformed
     */
    public static FilterPipeline create(PDFObject filterObj, PDFObject paramsObj,
            WritableByteChannel finalConsumer) {
        List<StreamFilter> filters = new ArrayList<>();
        List<String> filterNames = new ArrayList<>();
        List<PDFDictionary> paramsList = new ArrayList<>();

        if (filterObj == null || filterObj instanceof PDFNull) {
            return new FilterPipeline(finalConsumer, filters);
        } else if (filterObj instanceof Name) {
            filterNames.add(((Name) filterObj).getValue());
            paramsList.add(extractParams(paramsObj, 0));
        } else if (filterObj instanceof PDFArray) {
            PDFArray filterArray = (PDFArray) filterObj;
            for (int i = 0; i < filterArray.size(); i++) {
                PDFObject f = filterArray.get(i);
                if (!(f instanceof Name)) {
                    throw PDFParseException.invalidObject("Filter array element is not a name: "
                            + f.getKind(), -1);
                }
                filterNames.add(((Name) f).getValue());
                paramsList.add(extractParams(paramsObj, i));
            }
        } else {
            throw PDFParseException.invalidObject("Invalid /Filter value: " + filterObj.getKind(), -1);
        }

        // Truncate the chain at the first filter whose output stays encoded
        int count = filterNames.size();
        for (int i = 0; i < count; i++) {
            String filterName = filterNames.get(i);
            if (StreamFilter.isPassThrough(filterName)) {
                if (LOGGER.isLoggable(Level.FINER)) {
                    LOGGER.finer("Filter chain ends at pass-through filter " + filterName);
                }
                count = i;
                break;
            }
            if (StreamFilter.create(filterName) == null) {
                throw PDFParseException.unsupportedFeature("Unsupported filter /" + filterName);
            }
        }

        // Build pipeline in reverse order (last filter connects to consumer first)
        WritableByteChannel current = finalConsumer;
        for (int i = count - 1; i >= 0; i--) {
            String filterName = filterNames.get(i);
            PDFDictionary params = paramsList.get(i);
            if (PredictorFilter.isRequired(params) && isPredictorFilter(filterName)) {
                PredictorFilter predictor = new PredictorFilter();
                predictor.setParams(params);
                predictor.setNext(current);
                filters.add(0, predictor);
                current = predictor;
            }
            StreamFilter filter = StreamFilter.create(filterName);
            filter.setParams(params);
            filter.setNext(current);
            filters.add(0, filter);
            current = filter;
        }

        return new FilterPipeline(current, filters);
    }

    private static boolean isPredictorFilter(String filterName) {
        return "FlateDecode".equals(filterName) || "Fl".equals(filterName)
                || "LZWDecode".equals(filterName) || "LZW".equals(filterName);
    }

    /**
     * Extracts decode parameters for a specific filter index.
     */
    private static PDFDictionary extractParams(PDFObject paramsObj, int index) {
        if (paramsObj instanceof PDFDictionary) {
            // Single params dict - applies to single filter or first in chain
            return index == 0 ? (PDFDictionary) paramsObj : null;
        }
        if (paramsObj instanceof PDFArray) {
            PDFArray paramsArray = (PDFArray) paramsObj;
            if (index < paramsArray.size()) {
                PDFObject p = paramsArray.get(index);
                if (p instanceof PDFDictionary) {
                    return (PDFDictionary) p;
                }
            }
        }
        return null;
    }

    /**
     * Decodes a stream payload through the given filter chain.
     *
     * @param raw the encoded bytes
     * @param filter the /Filter value, may be null
     * @param decodeParms the /DecodeParms value, may be null
     * @return the decoded bytes
     * @throws PDFParseException of kind CORRUPTED_FILE if the payload is
     *         truncated or invalid, or UNSUPPORTED_FEATURE for an unknown
     *         filter
     */
    public static byte[] decode(byte[] raw, PDFObject filter, PDFObject decodeParms) {
        ByteBufferCollector collector = new ByteBufferCollector(raw.length * 2);
        FilterPipeline pipeline = create(filter, decodeParms, collector);
        if (!pipeline.hasFilters()) {
            return raw.clone();
        }
        try {
            ByteBuffer src = ByteBuffer.wrap(raw);
            while (src.hasRemaining()) {
                pipeline.write(src);
            }
            pipeline.close();
        } catch (IOException e) {
            throw new PDFParseException(PDFParseException.Kind.CORRUPTED_FILE,
                    "Cannot decode stream: " + e.getMessage(), -1, e);
        }
        return collector.toByteArray();
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        return head.write(src);
    }

    @Override
    public void close() throws IOException {
        head.close();
        open = false;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    /**
     * Returns true if this pipeline has any filters.
     *
     * @return true if there are filters in the pipeline
     */
    public boolean hasFilters() {
        return !filters.isEmpty();
    }

}
