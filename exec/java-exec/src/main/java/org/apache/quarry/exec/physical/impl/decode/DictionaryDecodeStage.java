/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.quarry.exec.physical.impl.decode;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.apache.quarry.common.config.QuarryConfig;
import org.apache.quarry.exec.ExecConstants;
import org.apache.quarry.exec.cache.Cache;
import org.apache.quarry.exec.cache.CacheProvider;
import org.apache.quarry.exec.cache.CacheType;
import org.apache.quarry.exec.cache.dictionary.Dictionary;
import org.apache.quarry.exec.cache.dictionary.DictionaryColumnIdentifier;
import org.apache.quarry.exec.cache.dictionary.DictionaryConstants;
import org.apache.quarry.exec.cache.dictionary.ReacquirableDictionary;
import org.apache.quarry.exec.expr.ClassGenerator;
import org.apache.quarry.exec.expr.ClassGenerator.HoldingContainer;
import org.apache.quarry.exec.ops.FragmentContext;
import org.apache.quarry.exec.physical.impl.InlineCodegenSupport;
import org.apache.quarry.exec.physical.impl.RowTransform;
import org.apache.quarry.exec.record.BatchSchema;
import org.apache.quarry.exec.record.Row;
import org.apache.quarry.exec.record.RowProjection;
import org.apache.quarry.exec.util.DataTypeUtil;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.sun.codemodel.JBlock;
import com.sun.codemodel.JClass;
import com.sun.codemodel.JCodeModel;
import com.sun.codemodel.JExpr;
import com.sun.codemodel.JExpression;
import com.sun.codemodel.JVar;

/**
 * Replaces the surrogate keys of dictionary-encoded columns with the values
 * they stand for. The decode plan is computed once; dictionaries are acquired
 * for each partition and released when the partition completes.
 * <p>
 * The operator runs either as a row iterator ({@link #execute}) or as code
 * emitted into a generated row routine ({@link #consume}). Both produce the
 * same rows.
 */
public class DictionaryDecodeStage implements RowTransform, InlineCodegenSupport {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DictionaryDecodeStage.class);

  private final DecodePlan plan;
  private final String storePath;
  private final Cache<DictionaryColumnIdentifier, Dictionary> cache;
  private final DictionaryAcquirer acquirer;

  public DictionaryDecodeStage(BatchSchema inputSchema, DecodeProfile profile, List<DecoderRelation> relations,
                               DecoderAliasMap aliasMap, QuarryConfig config) {
    this(DecodePlan.build(inputSchema, profile, relations, aliasMap),
        config.getString(ExecConstants.DICTIONARY_STORE_PATH),
        CacheProvider.getInstance().createCache(CacheType.FORWARD_DICTIONARY,
            config.getString(ExecConstants.DICTIONARY_STORE_PATH)),
        config.getBoolean(ExecConstants.DECODE_FAIL_ON_MISSING_DICTIONARY));
  }

  @VisibleForTesting
  public DictionaryDecodeStage(DecodePlan plan, String storePath,
                               Cache<DictionaryColumnIdentifier, Dictionary> cache, boolean failOnMissing) {
    this.plan = plan;
    this.storePath = storePath;
    this.cache = cache;
    this.acquirer = new DictionaryAcquirer(plan, storePath, failOnMissing);
  }

  public DecodePlan getPlan() {
    return plan;
  }

  @Override
  public BatchSchema getOutputSchema() {
    return plan.getOutputSchema();
  }

  @Override
  public Iterator<Row> execute(FragmentContext context, Iterator<Row> input) {
    if (!plan.isRequiredToDecode()) {
      return input;
    }
    Dictionary[] dictionaries = acquirer.acquire(cache);
    DictionaryLifecycleManager.releaseOnCompletion(context, dictionaries);
    return new DictionaryDecodeIterator(input, plan, dictionaries, new RowProjection(getOutputSchema()));
  }

  @Override
  public List<HoldingContainer> consume(ClassGenerator<?> cg, List<HoldingContainer> input) {
    if (!plan.isRequiredToDecode()) {
      return input;
    }

    // Probe which dictionaries can be fetched; columns without one pass through.
    ReacquirableDictionary[] probes = acquirer.acquireReacquirable(cache);
    for (ReacquirableDictionary probe : probes) {
      if (probe != null) {
        probe.release();
      }
    }

    JCodeModel model = cg.getModel();
    PartitionDictionaries reference = new PartitionDictionaries(probes);
    JVar dictionaries = cg.addReferenceObj(reference, model.ref(ReacquirableDictionary.class).array());

    ImmutableList.Builder<HoldingContainer> output = ImmutableList.builder();
    for (int i = 0; i < input.size(); i++) {
      DecodePlan.Entry entry = plan.getEntry(i);
      if (entry == null || !reference.hasDictionary(i)) {
        output.add(input.get(i));
      } else {
        output.add(generateDecode(cg, dictionaries, i, entry, input.get(i)));
      }
    }
    logger.debug("Generated decode code for {}", plan.getEntries());
    return output.build();
  }

  private HoldingContainer generateDecode(ClassGenerator<?> cg, JVar dictionaries, int index,
                                          DecodePlan.Entry entry, HoldingContainer in) {
    JCodeModel model = cg.getModel();
    HoldingContainer out = cg.declare(getOutputSchema().getColumn(index).getType(), JExpr._null());

    JBlock notNull = cg.getEvalBlock()._if(in.getHolder().ne(JExpr._null()))._then();
    JVar key = notNull.decl(model.INT, cg.getNextVar("key"),
        ((JExpression) JExpr.cast(model.ref(Number.class), in.getHolder())).invoke("intValue"));
    JVar bytes = notNull.decl(model.BYTE.array(), cg.getNextVar("bytes"),
        ((JExpression) dictionaries.component(JExpr.lit(index))).invoke("getDictionaryValueForKeyInBytes").arg(key));
    notNull._if(bytes.eq(JExpr._null()))._then()
        ._throw(model.ref(DictionaryDecodeIterator.class).staticInvoke("missingSurrogateKey")
            .arg(JExpr.lit(entry.getDimension().getName())).arg(key));

    JClass constants = model.ref(DictionaryConstants.class);
    JBlock present = notNull._if(model.ref(Arrays.class).staticInvoke("equals")
        .arg(bytes).arg(constants.staticRef("MEMBER_DEFAULT_VAL_ARRAY")).not())._then();
    JVar text = present.decl(model.ref(String.class), cg.getNextVar("text"),
        JExpr._new(model.ref(String.class)).arg(bytes).arg(constants.staticRef("DEFAULT_CHARSET_CLASS")));
    present.assign(out.getHolder(), parse(model, entry, text));
    return out;
  }

  private static JExpression parse(JCodeModel model, DecodePlan.Entry entry, JVar text) {
    switch (entry.getDimension().getDataKind()) {
    case STRING:
      return text;
    case SHORT:
      return box(model, Short.class, "parseShort", text);
    case INT:
      return box(model, Integer.class, "parseInt", text);
    case LONG:
      return box(model, Long.class, "parseLong", text);
    case DOUBLE:
      return box(model, Double.class, "parseDouble", text);
    case DECIMAL:
      return JExpr._new(model.ref(BigDecimal.class)).arg(text);
    case BOOLEAN:
      return model.ref(DataTypeUtil.class).staticInvoke("parseBoolean").arg(text);
    case TIMESTAMP:
      return model.ref(DataTypeUtil.class).staticInvoke("parseTimestamp").arg(text);
    case DATE:
      return model.ref(DataTypeUtil.class).staticInvoke("parseDate").arg(text);
    default:
      throw new IllegalStateException("No decode code for data kind " + entry.getDimension().getDataKind());
    }
  }

  private static JExpression box(JCodeModel model, Class<?> boxed, String parseMethod, JVar text) {
    JClass type = model.ref(boxed);
    return type.staticInvoke("valueOf").arg(type.staticInvoke(parseMethod).arg(text));
  }

  @Override
  public String toString() {
    return "DictionaryDecodeStage [storePath=" + storePath + ", plan=" + plan.getEntries() + "]";
  }
}
