package im.arun.mathmarkup.symbols;

import im.arun.mathmarkup.model.DifferentialStyle;
import im.arun.mathmarkup.model.IntegralType;
import lombok.Value;

/**
 * A fully spelled integral command such as {@code \iintdsublim}.
 */
@Value
public class IntegralCommand {
    IntegralType integralType;
    DifferentialStyle differentialStyle;
    IntegralForm form;

    public String getSpelling() {
        return "\\" + integralType.getCommandBase() + differentialStyle.getCommandInfix() + form.getSuffix();
    }

    public int getArity() {
        return form.getArity();
    }
}
